package com.adlanda.codecontext.service;

public class SourceFileNotFoundException extends RuntimeException {

    public SourceFileNotFoundException(String fileId) {
        super("File not found: " + fileId);
    }
}
