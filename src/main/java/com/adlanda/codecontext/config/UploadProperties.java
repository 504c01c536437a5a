package com.adlanda.codecontext.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Configuration properties for file uploads.
 *
 * Maps to properties prefixed with 'codecontext.upload' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "codecontext.upload")
public class UploadProperties {

    /**
     * Largest accepted file content, measured in UTF-8 bytes.
     */
    private DataSize maxFileSize = DataSize.ofMegabytes(10);

    public DataSize getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }
}
