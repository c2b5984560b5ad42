package it.piero.remoteforms.model.layout;

public class Column extends Div {

    public Column(LayoutObject... fields) {
        super(fields);
        cssClass("column");
    }
}
