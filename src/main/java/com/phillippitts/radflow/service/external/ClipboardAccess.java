package com.phillippitts.radflow.service.external;

import java.util.Optional;

/**
 * System clipboard seam. Only used under the paste lock.
 */
public interface ClipboardAccess {

    void setText(String text);

    Optional<String> getText();
}
