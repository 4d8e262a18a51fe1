package com.docweaver.core.assembly;

/**
 * The assembler could not produce the document.
 */
public class AssemblyException extends RuntimeException {

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
