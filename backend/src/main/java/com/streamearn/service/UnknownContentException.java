package com.streamearn.service;

import lombok.Getter;

@Getter
public class UnknownContentException extends RuntimeException {

    private final String contentId;

    public UnknownContentException(String contentId) {
        super("Unknown content: " + contentId);
        this.contentId = contentId;
    }
}
