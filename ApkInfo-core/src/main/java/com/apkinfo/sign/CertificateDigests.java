package com.apkinfo.sign;

/**
 * Lower-case hex fingerprints of the signing certificate. A digest the tool
 * did not print is the empty string.
 */
public final class CertificateDigests {

    public static final CertificateDigests EMPTY = new CertificateDigests("", "", "");

    private final String mMd5;
    private final String mSha1;
    private final String mSha256;

    public CertificateDigests(String md5, String sha1, String sha256) {
        this.mMd5 = md5 == null ? "" : md5;
        this.mSha1 = sha1 == null ? "" : sha1;
        this.mSha256 = sha256 == null ? "" : sha256;
    }

    public String getMd5() {
        return mMd5;
    }

    public String getSha1() {
        return mSha1;
    }

    public String getSha256() {
        return mSha256;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CertificateDigests)) {
            return false;
        }
        CertificateDigests other = (CertificateDigests) obj;
        return mMd5.equals(other.mMd5) && mSha1.equals(other.mSha1) && mSha256.equals(other.mSha256);
    }

    @Override
    public int hashCode() {
        int result = mMd5.hashCode();
        result = 31 * result + mSha1.hashCode();
        return 31 * result + mSha256.hashCode();
    }

    @Override
    public String toString() {
        return String.format("md5=%s sha1=%s sha256=%s", mMd5, mSha1, mSha256);
    }
}
