package com.apkinfo.androlib.res;

import com.apkinfo.androlib.AndrolibException;
import com.apkinfo.androlib.ResourceCycleException;
import com.apkinfo.androlib.ResourceNotFoundException;
import com.apkinfo.androlib.res.data.ResConfig;
import com.apkinfo.androlib.res.data.ResEntry;
import com.apkinfo.androlib.res.data.ResID;
import com.apkinfo.androlib.res.data.ResTable;
import com.apkinfo.androlib.res.data.ResValue;

import java.util.List;
import java.util.logging.Logger;

/**
 * Picks the variant of a resource that best fits a device configuration and
 * follows references until a literal value is reached.
 * <p>
 * Candidates whose non-density qualifiers contradict the request are dropped.
 * The rest are ranked by density: the smallest density at or above the
 * requested one, else the largest below it, then the unqualified variant,
 * then {@code anydpi}, then {@code nodpi}. Equal ranks fall back to the
 * variant declaring more qualifiers, then to {@link ResConfig} order, then to
 * table order.
 */
public class ResourceResolver {

  private static final Logger LOGGER = Logger.getLogger(ResourceResolver.class.getName());

  public static final int MAX_DEPTH = 10;

  // density used to rank numeric variants when the request leaves density unset
  private static final int FALLBACK_DENSITY = ResConfig.DENSITY_MEDIUM;

  private static final int RANK_AT_OR_ABOVE = 0;
  private static final int RANK_BELOW = 1;
  private static final int RANK_DEFAULT = 2;
  private static final int RANK_ANY = 3;
  private static final int RANK_NONE = 4;

  private final ResTable mTable;

  public ResourceResolver(ResTable table) {
    if (table == null) {
      throw new IllegalArgumentException("table is null");
    }
    this.mTable = table;
  }

  /**
   * Resolves {@code resID} for {@code request} ({@code null} meaning the
   * default configuration) and follows up to {@link #MAX_DEPTH} references.
   *
   * @throws ResourceNotFoundException no variant of the id, or of an id it refers to, fits
   * @throws ResourceCycleException the reference chain is longer than {@link #MAX_DEPTH}
   */
  public ResValue resolve(ResID resID, ResConfig request) throws AndrolibException {
    ResID current = resID;
    for (int depth = 0; ; depth++) {
      ResEntry entry = resolveEntry(current, request);
      ResValue value = entry.getValue();
      if (value == null) {
        throw new ResourceNotFoundException(current, String.format("%s is a complex resource", current));
      }
      if (!value.isReference()) {
        return value;
      }
      if (depth == MAX_DEPTH) {
        throw new ResourceCycleException(resID, depth);
      }
      ResID next = value.getReference();
      if (next.id == 0) {
        throw new ResourceNotFoundException(current, String.format("%s refers to @null", current));
      }
      LOGGER.fine(String.format("%s -> %s", current, next));
      current = next;
    }
  }

  /**
   * The best variant of {@code resID} without following references.
   *
   * @throws ResourceNotFoundException the id is unknown or no variant fits the request
   */
  public ResEntry resolveEntry(ResID resID, ResConfig request) throws ResourceNotFoundException {
    if (request == null) {
      request = ResConfig.DEFAULT;
    }
    List<ResEntry> entries = mTable.getEntries(resID);
    if (entries.isEmpty()) {
      throw new ResourceNotFoundException(resID);
    }
    ResEntry best = null;
    for (ResEntry entry : entries) {
      if (!entry.getConfig().matches(request)) {
        continue;
      }
      // strict comparison keeps the first-declared of fully equal variants
      if (best == null || compare(entry.getConfig(), best.getConfig(), request) < 0) {
        best = entry;
      }
    }
    if (best == null) {
      throw new ResourceNotFoundException(resID,
          String.format("no variant of %s matches %s", resID, request));
    }
    return best;
  }

  /** Negative when {@code a} is a better fit for {@code request} than {@code b}. */
  static int compare(ResConfig a, ResConfig b, ResConfig request) {
    int requested = request.getDensity();
    int result = Integer.compare(rank(a.getDensity(), requested), rank(b.getDensity(), requested));
    if (result != 0) {
      return result;
    }
    result = Integer.compare(distance(a.getDensity(), requested), distance(b.getDensity(), requested));
    if (result != 0) {
      return result;
    }
    result = Integer.compare(b.getQualifierCount(), a.getQualifierCount());
    if (result != 0) {
      return result;
    }
    return a.compareTo(b);
  }

  private static int rank(int density, int requested) {
    if (density == ResConfig.DENSITY_NONE) {
      return RANK_NONE;
    }
    if (density == ResConfig.DENSITY_ANY) {
      return RANK_ANY;
    }
    if (density == ResConfig.DENSITY_DEFAULT) {
      // an unset request is served by the unqualified variant first
      return requested == ResConfig.DENSITY_DEFAULT ? -1 : RANK_DEFAULT;
    }
    return density >= effective(requested) ? RANK_AT_OR_ABOVE : RANK_BELOW;
  }

  private static int distance(int density, int requested) {
    if (density == ResConfig.DENSITY_DEFAULT || density == ResConfig.DENSITY_ANY
        || density == ResConfig.DENSITY_NONE) {
      return 0;
    }
    return Math.abs(density - effective(requested));
  }

  private static int effective(int requested) {
    if (requested == ResConfig.DENSITY_DEFAULT || requested == ResConfig.DENSITY_ANY
        || requested == ResConfig.DENSITY_NONE) {
      return FALLBACK_DENSITY;
    }
    return requested;
  }
}
