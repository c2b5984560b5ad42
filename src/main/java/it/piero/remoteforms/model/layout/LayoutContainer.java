package it.piero.remoteforms.model.layout;

import java.util.List;

public interface LayoutContainer extends LayoutObject {

    List<LayoutObject> getFields();
}
