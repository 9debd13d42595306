package com.apkinfo.parser.cli;

import com.apkinfo.androlib.AndrolibException;
import com.apkinfo.androlib.ManifestInfo;
import com.apkinfo.parser.ApkInfo;
import com.apkinfo.parser.Configuration;
import com.apkinfo.parser.InputParam;
import com.apkinfo.parser.Main;
import com.apkinfo.sign.SignatureExtractor;
import com.apkinfo.util.TypedValue;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Command line front end: prints the metadata of one apk.
 */
public class CliMain extends Main {

    private static final String ARG_HELP     = "--help";
    private static final String ARG_CONFIG   = "-config";
    private static final String ARG_KEYTOOL  = "-keytool";
    private static final String ARG_TIMEOUT  = "-timeout";
    private static final String ARG_ICON     = "-icon";
    private static final String ARG_DENSITY  = "-density";
    private static final String ARG_LOCALE   = "-locale";

    private final PrintStream mOut;
    private final PrintStream mErr;
    private final SignatureExtractor mSignatureExtractor;

    public CliMain(PrintStream out, PrintStream err, SignatureExtractor signatureExtractor) {
        this.mOut = out;
        this.mErr = err;
        this.mSignatureExtractor = signatureExtractor;
    }

    public static void main(String[] args) {
        CliMain m = new CliMain(System.out, System.err, null);
        int status = m.run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    private static void printUsage(PrintStream out) {
        String command = "apkinfo.jar";
        out.println();
        out.println("Usage: java -jar " + command + " input.apk [flags]");
        out.println("Such as: java -jar " + command + " input.apk " + ARG_ICON + " icon.png " + ARG_LOCALE + " fr-FR");
        out.println();
        out.println("Flags:\n");

        printUsage(out, new String[]{
            ARG_HELP, "This message.",
            "-h", "short for --help",
            ARG_CONFIG, "set the config file, such as config.xml",
            ARG_KEYTOOL, "set the keytool path, the default is the keytool on PATH",
            ARG_TIMEOUT, "seconds keytool may run before it is killed, the default is "
                + Configuration.DEFAULT_KEYTOOL_TIMEOUT_SECONDS,
            ARG_ICON, "decode the launcher icon and write it to the given file",
            ARG_DENSITY, "screen density the icon is picked for, the default is "
                + Configuration.DEFAULT_ICON_DENSITY,
            ARG_LOCALE, "locale the label is picked for, such as fr or fr-FR",
        });
    }

    private static void printUsage(PrintStream out, String[] args) {
        int argWidth = 0;
        for (int i = 0; i < args.length; i += 2) {
            argWidth = Math.max(argWidth, args[i].length());
        }
        argWidth += 2;
        String formatString = "%1$-" + argWidth + "s%2$s%n"; //$NON-NLS-1$

        for (int i = 0; i < args.length; i += 2) {
            out.printf(formatString, args[i], args[i + 1]);
        }
    }

    /**
     * @return process exit status
     */
    public int run(String[] args) {
        if (args.length < 1) {
            printUsage(mErr);
            return ERRNO_USAGE;
        }
        InputParam inputParam;
        try {
            inputParam = readArgs(args);
        } catch (IllegalArgumentException e) {
            mErr.println(e.getMessage());
            printUsage(mErr);
            return ERRNO_USAGE;
        }
        if (inputParam == null) {
            printUsage(mOut);
            return 0;
        }

        ApkInfo info;
        try {
            info = run(inputParam, mSignatureExtractor);
        } catch (AndrolibException | IOException e) {
            mErr.printf("Could not read %s: %s\n", inputParam.apkPath, e.getMessage());
            return ERRNO_ERRORS;
        }
        print(info);

        if (inputParam.iconOutput != null) {
            if (info.icon == null) {
                mErr.println("no icon to write");
                return ERRNO_ERRORS;
            }
            try {
                FileUtils.writeByteArrayToFile(inputParam.iconOutput, info.icon.getBytes());
            } catch (IOException e) {
                mErr.printf("Could not write icon %s: %s\n", inputParam.iconOutput, e.getMessage());
                return ERRNO_ERRORS;
            }
            mOut.printf("icon written to %s\n", inputParam.iconOutput.getAbsolutePath());
        }
        return 0;
    }

    private void print(ApkInfo info) {
        mOut.printf("label: %s\n", info.label);
        mOut.printf("package: %s\n", info.packageName);
        mOut.printf("versionName: %s\n", info.versionName);
        mOut.printf("versionCode: %d\n", info.versionCode);
        mOut.printf("minSdkVersion: %d\n", info.minSdkVersion);
        mOut.printf("targetSdkVersion: %d\n", info.targetSdkVersion);
        mOut.printf("size: %d\n", info.size);
        mOut.printf("md5: %s\n", info.fileMd5);
        mOut.printf("signature md5: %s\n", info.signatureMd5);
        mOut.printf("signature sha1: %s\n", info.signatureSha1);
        mOut.printf("signature sha256: %s\n", info.signatureSha256);
        mOut.printf("64-bit: %b\n", info.supports64Bit);
        mOut.printf("32-bit: %b\n", info.supports32Bit);
        mOut.printf("abis: %s\n", String.join(",", info.nativeAbis));
        if (info.icon != null) {
            mOut.printf("icon: %s\n", info.icon);
        }
        for (String permission : info.permissions) {
            mOut.printf("uses-permission: %s\n", permission);
        }
        for (ManifestInfo.Permission permission : info.declaredPermissions) {
            mOut.printf("permission: %s\n", permission);
        }
    }

    /**
     * @return the parsed parameters, {@code null} when help was requested
     * @throws IllegalArgumentException a flag is unknown or misses its value
     */
    private InputParam readArgs(String[] args) {
        InputParam.Builder builder = new InputParam.Builder();
        String apkFileName = null;
        for (int index = 0; index < args.length; index++) {
            String arg = args[index];
            if (arg.equals(ARG_HELP) || arg.equals("-h")) {
                return null;
            } else if (arg.equals(ARG_CONFIG)) {
                String value = value(args, index++, arg);
                if (!value.endsWith(TypedValue.XML_FILE)) {
                    throw new IllegalArgumentException("Missing XML configuration file argument");
                }
                builder.setConfigFile(new File(value));
            } else if (arg.equals(ARG_KEYTOOL)) {
                builder.setKeytoolPath(value(args, index++, arg));
            } else if (arg.equals(ARG_TIMEOUT)) {
                builder.setKeytoolTimeoutSeconds(number(value(args, index++, arg), arg));
            } else if (arg.equals(ARG_ICON)) {
                builder.setIconOutput(new File(value(args, index++, arg)));
            } else if (arg.equals(ARG_DENSITY)) {
                builder.setIconDensity(number(value(args, index++, arg), arg));
            } else if (arg.equals(ARG_LOCALE)) {
                builder.setLabelLocale(value(args, index++, arg));
            } else if (arg.startsWith("-")) {
                throw new IllegalArgumentException("unknown flag " + arg);
            } else if (apkFileName == null) {
                apkFileName = arg;
            } else {
                throw new IllegalArgumentException("only one apk can be read at a time, got " + arg);
            }
        }
        if (apkFileName == null) {
            throw new IllegalArgumentException("Missing input apk argument");
        }
        return builder.setApkPath(apkFileName).create();
    }

    private static String value(String[] args, int index, String flag) {
        if (index == args.length - 1) {
            throw new IllegalArgumentException("Missing argument of " + flag);
        }
        return args[index + 1];
    }

    private static int number(String value, String flag) {
        try {
            int number = Integer.parseInt(value);
            if (number <= 0) {
                throw new IllegalArgumentException(flag + " must be positive: " + value);
            }
            return number;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number, got " + value);
        }
    }
}
