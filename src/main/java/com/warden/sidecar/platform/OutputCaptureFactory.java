package com.warden.sidecar.platform;

@FunctionalInterface
public interface OutputCaptureFactory {

    OutputCapture create(String tenantId);
}
