package com.edge.odometry.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库，必须在任何 Mat 操作之前调用
 */
public final class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static final String OPENCV_LIBRARY = "opencv_java470";

    private static volatile boolean loaded = false;

    private NativeLibraryLoader() {
    }

    /**
     * 加载 OpenCV native 库，重复调用无副作用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        boolean isNativeImage = System.getProperty("org.graalvm.nativeimage.imagecode") != null;

        if (!isNativeImage) {
            // JAR 模式：openpnp 把库解压到临时目录再加载（Java 12+ 上 loadShared 已不可用）
            logger.info("Running in JAR mode, loading OpenCV via openpnp...");
            try {
                nu.pattern.OpenCV.loadLocally();
                loaded = true;
                logger.info("OpenCV {} loaded successfully via openpnp", org.opencv.core.Core.VERSION);
            } catch (Throwable e) {
                logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
            }
            return;
        }

        logger.info("Running in native-image mode, loading OpenCV from application directory...");
        loadOpenCVNative(System.getProperty("user.dir"));
        loaded = true;
    }

    /**
     * native-image 模式下手动加载：先找应用目录，再回退到系统库路径
     */
    private static void loadOpenCVNative(String appDir) {
        String libFileName = System.mapLibraryName(OPENCV_LIBRARY);

        File libFile = new File(appDir, libFileName);
        if (libFile.exists()) {
            try {
                System.load(libFile.getAbsolutePath());
                logger.info("OpenCV loaded successfully from: {}", libFile.getAbsolutePath());
                return;
            } catch (UnsatisfiedLinkError e) {
                logger.warn("Failed to load OpenCV from {}: {}", libFile, e.getMessage());
            }
        }

        try {
            System.loadLibrary(OPENCV_LIBRARY);
            logger.info("OpenCV loaded successfully from system library path");
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library. Please ensure {} is in the application directory or system library path", libFileName);
            throw new RuntimeException("OpenCV native library not found: " + libFileName, e);
        }
    }
}
