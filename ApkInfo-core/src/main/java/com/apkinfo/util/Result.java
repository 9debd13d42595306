package com.apkinfo.util;

/**
 * Outcome of a best-effort step: either a value or the exception that
 * prevented it. A failed result never propagates on its own; the caller
 * decides what an absent value means.
 */
public final class Result<T> {
  private final T mValue;
  private final Exception mError;

  private Result(T value, Exception error) {
    this.mValue = value;
    this.mError = error;
  }

  public static <T> Result<T> success(T value) {
    return new Result<>(value, null);
  }

  public static <T> Result<T> failure(Exception error) {
    if (error == null) {
      throw new IllegalArgumentException("error is null");
    }
    return new Result<>(null, error);
  }

  public boolean isSuccess() {
    return mError == null;
  }

  /** The value, {@code null} for a failed result. */
  public T getValue() {
    return mValue;
  }

  public Exception getError() {
    return mError;
  }

  public T orElse(T fallback) {
    return isSuccess() && mValue != null ? mValue : fallback;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success[" + mValue + "]" : "Failure[" + mError + "]";
  }
}
