package com.williamcallahan.mdcanvas.service.markup;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens links in the desktop browser through {@link Desktop}, when the platform supports it.
 */
public class DesktopResourceOpener implements ResourceOpener {

    private static final Logger log = LoggerFactory.getLogger(DesktopResourceOpener.class);

    @Override
    public boolean open(String url) {
        if (!isBrowseSupported()) {
            log.info("Desktop browsing unavailable; not opening {}", url);
            return false;
        }
        try {
            Desktop.getDesktop().browse(new URI(url));
            return true;
        } catch (URISyntaxException invalidUrl) {
            log.warn("Link target is not a valid URI: {}", url);
            return false;
        } catch (IOException | UnsupportedOperationException | SecurityException browseFailure) {
            log.warn("Failed to open link target {}: {}", url, browseFailure.getMessage());
            return false;
        }
    }

    boolean isBrowseSupported() {
        return !GraphicsEnvironment.isHeadless()
            && Desktop.isDesktopSupported()
            && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE);
    }
}
