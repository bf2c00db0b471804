package com.baykanat.funnel.domain.exception;

/** Geçersiz funnel/hedef tanımı veya parametre; sorgu atılmadan fırlatılır. GlobalExceptionHandler 400 döner. */
public class InvalidArgumentException extends RuntimeException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
