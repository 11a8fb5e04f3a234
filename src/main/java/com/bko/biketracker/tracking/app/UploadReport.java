package com.bko.biketracker.tracking.app;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class UploadReport {
    private final List<String> messages = new ArrayList<>();
    private boolean success = true;
    private boolean alreadyUploaded;
    private String externalReference;

    public void info(String message) {
        messages.add(message);
    }

    public void warn(String message) {
        messages.add("WARN: " + message);
    }

    public void error(String message) {
        messages.add("ERROR: " + message);
        success = false;
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isAlreadyUploaded() {
        return alreadyUploaded;
    }

    public void setAlreadyUploaded(boolean alreadyUploaded) {
        this.alreadyUploaded = alreadyUploaded;
    }

    public String getExternalReference() {
        return externalReference;
    }

    public void setExternalReference(String externalReference) {
        this.externalReference = externalReference;
    }
}
