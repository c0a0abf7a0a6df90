package com.williamcallahan.mdcanvas.service.markup;

/**
 * Host capability that opens an external resource such as a link target.
 */
@FunctionalInterface
public interface ResourceOpener {

    /**
     * Opens the resource.
     *
     * @param url link target
     * @return true when the host accepted the request
     */
    boolean open(String url);
}
