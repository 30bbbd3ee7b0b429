package org.calista.grila.crossword.dictionary;

import java.io.IOException;

/**
 * The dictionary source is missing, unreadable or yields no usable entries.
 */
public final class DictionaryLoadException extends IOException {

    public DictionaryLoadException(String message) {
        super(message);
    }

    public DictionaryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
