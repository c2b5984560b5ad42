package it.piero.remoteforms.model.layout;

public class Row extends Div {

    public Row(LayoutObject... fields) {
        super(fields);
        cssClass("row");
    }
}
