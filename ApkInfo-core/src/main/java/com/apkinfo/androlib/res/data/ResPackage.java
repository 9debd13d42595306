/**
 * Copyright 2014 Ryszard Wiśniewski <brut.alll@gmail.com>
 * Copyright 2016 sim sun <sunsj1231@gmail.com>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apkinfo.androlib.res.data;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class ResPackage {
  private final int mId;
  private final String mName;

  private final Map<Integer, ResType> mTypes;

  public ResPackage(int id, String name) {
    this.mId = id;
    this.mName = name;
    mTypes = new LinkedHashMap<>();
  }

  public int getId() {
    return mId;
  }

  public String getName() {
    return mName;
  }

  /**
   * Returns the type with {@code typeId}, creating it on first use. A package
   * usually holds several type chunks per type id, one per configuration.
   */
  public ResType getOrCreateType(int typeId, String typeName) {
    ResType type = mTypes.get(typeId);
    if (type == null) {
      type = new ResType(typeId, typeName, this);
      mTypes.put(typeId, type);
    }
    return type;
  }

  public ResType getType(int typeId) {
    return mTypes.get(typeId);
  }

  public Collection<ResType> getTypes() {
    return Collections.unmodifiableCollection(mTypes.values());
  }

  /** Folds the types of a second chunk declaring the same package id into this one. */
  void merge(ResPackage other) {
    for (ResType type : other.mTypes.values()) {
      getOrCreateType(type.getId(), type.getName()).addAll(type);
    }
  }

  void seal() {
    for (ResType type : mTypes.values()) {
      type.seal();
    }
  }

  @Override
  public String toString() {
    return mName;
  }
}
