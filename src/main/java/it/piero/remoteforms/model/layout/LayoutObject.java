package it.piero.remoteforms.model.layout;

public interface LayoutObject {

    default String getTypeName() {
        return getClass().getSimpleName();
    }
}
