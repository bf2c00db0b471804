package com.baykanat.funnel.domain.exception;

/** Funnel veya hedef bulunamadı (ya da silinmiş); 404. */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
