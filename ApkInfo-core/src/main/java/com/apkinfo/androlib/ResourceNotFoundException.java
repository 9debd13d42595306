package com.apkinfo.androlib;

import com.apkinfo.androlib.res.data.ResID;

public class ResourceNotFoundException extends AndrolibException {
    private final ResID mResID;

    public ResourceNotFoundException(ResID resID) {
        super(String.format("no entry recorded for resource %s", resID));
        this.mResID = resID;
    }

    public ResourceNotFoundException(ResID resID, String message) {
        super(message);
        this.mResID = resID;
    }

    public ResID getResID() {
        return mResID;
    }
}
