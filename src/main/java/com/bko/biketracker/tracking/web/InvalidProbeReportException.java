package com.bko.biketracker.tracking.web;

public class InvalidProbeReportException extends RuntimeException {
    public InvalidProbeReportException(String message) {
        super(message);
    }
}
