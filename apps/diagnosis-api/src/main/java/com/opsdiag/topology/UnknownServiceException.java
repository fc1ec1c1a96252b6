package com.opsdiag.topology;

public class UnknownServiceException extends RuntimeException {

    private final String service;

    public UnknownServiceException(String service) {
        super("service not registered in topology: " + service);
        this.service = service;
    }

    public String service() {
        return service;
    }
}
