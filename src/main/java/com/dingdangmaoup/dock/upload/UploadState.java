package com.dingdangmaoup.dock.upload;

public enum UploadState {
    CREATED,
    ACCEPTING,
    COMMITTING,
    COMPLETED,
    CANCELLED,
    EXPIRED
}
