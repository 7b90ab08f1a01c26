package com.vuong.resthandler.core.export;

import org.springframework.http.MediaType;

/**
 * Media types not declared by {@link MediaType}.
 */
public final class MediaTypes {

    public static final MediaType TEXT_CSV = new MediaType("text", "csv");

    private MediaTypes() {
    }
}
