/**
 *  Copyright 2014 Ryszard Wiśniewski <brut.alll@gmail.com>
 *  Copyright 2016 sim sun <sunsj1231@gmail.com>
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package com.apkinfo.androlib.res.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ResType {
    private final int        mId;
    private final String     mName;
    private final ResPackage mPackage;

    private final Map<Integer, List<ResEntry>> mEntries;
    private boolean mSealed;

    public ResType(int id, String name, ResPackage package_) {
        this.mId = id;
        this.mName = name;
        this.mPackage = package_;
        mEntries = new LinkedHashMap<>();
    }

    public int getId() {
        return mId;
    }

    public String getName() {
        return mName;
    }

    public ResPackage getPackage() {
        return mPackage;
    }

    /**
     * Records one configuration variant of entry {@code entryIndex}. Variants
     * keep the order in which the table declares them.
     */
    public void addEntry(int entryIndex, ResEntry entry) {
        if (mSealed) {
            throw new IllegalStateException(String.format("type %s is read-only", mName));
        }
        List<ResEntry> variants = mEntries.get(entryIndex);
        if (variants == null) {
            variants = new ArrayList<>();
            mEntries.put(entryIndex, variants);
        }
        variants.add(entry);
    }

    public List<ResEntry> getEntries(int entryIndex) {
        List<ResEntry> variants = mEntries.get(entryIndex);
        if (variants == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(variants);
    }

    /** Appends every variant of {@code other} after the ones already recorded. */
    void addAll(ResType other) {
        for (Map.Entry<Integer, List<ResEntry>> entry : other.mEntries.entrySet()) {
            for (ResEntry variant : entry.getValue()) {
                addEntry(entry.getKey(), variant);
            }
        }
    }

    void seal() {
        mSealed = true;
    }

    @Override
    public String toString() {
        return mName;
    }
}
