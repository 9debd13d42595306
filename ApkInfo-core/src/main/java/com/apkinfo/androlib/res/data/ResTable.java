package com.apkinfo.androlib.res.data;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Decoded {@code resources.arsc}: package, type and entry index addressed by
 * {@link ResID}. Read-only once constructed.
 */
public final class ResTable {
  private static final Logger LOGGER = Logger.getLogger(ResTable.class.getName());

  private final Map<Integer, ResPackage> mPackages;

  public ResTable(Collection<ResPackage> packages) {
    Map<Integer, ResPackage> byId = new LinkedHashMap<>();
    for (ResPackage pkg : packages) {
      ResPackage first = byId.get(pkg.getId());
      if (first == null) {
        byId.put(pkg.getId(), pkg);
        continue;
      }
      LOGGER.warning(String.format("package 0x%02x declared again as %s, merging its types into %s",
          pkg.getId(), pkg.getName(), first.getName()));
      first.merge(pkg);
    }
    for (ResPackage pkg : byId.values()) {
      pkg.seal();
    }
    mPackages = Collections.unmodifiableMap(byId);
  }

  public Collection<ResPackage> getPackages() {
    return mPackages.values();
  }

  public ResPackage getPackage(int packageId) {
    return mPackages.get(packageId);
  }

  /**
   * All recorded variants of {@code resID} in declaration order; empty when the
   * package, the type or the entry is unknown.
   */
  public List<ResEntry> getEntries(ResID resID) {
    ResPackage pkg = mPackages.get(resID.package_);
    if (pkg == null) {
      return Collections.emptyList();
    }
    ResType type = pkg.getType(resID.type);
    if (type == null) {
      return Collections.emptyList();
    }
    return type.getEntries(resID.entry);
  }

  /** {@code package:type/name}, or {@code null} when the id is unknown. */
  public String getResourceName(ResID resID) {
    List<ResEntry> entries = getEntries(resID);
    if (entries.isEmpty()) {
      return null;
    }
    ResPackage pkg = mPackages.get(resID.package_);
    ResType type = pkg.getType(resID.type);
    return pkg.getName() + ":" + type.getName() + "/" + entries.get(0).getName();
  }
}
