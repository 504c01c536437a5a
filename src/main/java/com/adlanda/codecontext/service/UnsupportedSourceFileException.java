package com.adlanda.codecontext.service;

/**
 * Raised for uploads that are never used as code context, such as dependency
 * folders, build output or environment files.
 */
public class UnsupportedSourceFileException extends RuntimeException {

    public UnsupportedSourceFileException(String fileName) {
        super("File type is excluded from code context: " + fileName);
    }
}
