package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the backing file cannot be read, written or (un)marshalled
@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR)
public class StorageException extends RuntimeException {

    public StorageException(String errMsg)  {
        super(errMsg);
    }

    public StorageException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
