package com.apkinfo.androlib;

import com.apkinfo.androlib.res.data.ResID;

/**
 * Following resource references did not reach a literal value within the
 * allowed number of hops.
 */
public class ResourceCycleException extends AndrolibException {
    private final ResID mResID;
    private final int   mDepth;

    public ResourceCycleException(ResID resID, int depth) {
        super(String.format("resource %s still a reference after %d hops", resID, depth));
        this.mResID = resID;
        this.mDepth = depth;
    }

    public ResID getResID() {
        return mResID;
    }

    public int getDepth() {
        return mDepth;
    }
}
