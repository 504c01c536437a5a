package com.adlanda.codecontext.service;

/**
 * Raised for uploads whose content exceeds the configured size limit.
 */
public class SourceFileTooLargeException extends RuntimeException {

    public SourceFileTooLargeException(String fileName, long sizeBytes, long limitBytes) {
        super("File " + fileName + " is " + sizeBytes + " bytes, the limit is " + limitBytes + " bytes");
    }
}
