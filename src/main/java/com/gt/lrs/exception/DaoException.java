package com.gt.lrs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the store is unavailable or rejects a write. Nothing from the failed call is persisted.
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class DaoException extends RuntimeException {

    public DaoException(String errMsg)  {
        super(errMsg);
    }

    public DaoException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
