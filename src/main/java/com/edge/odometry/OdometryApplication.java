package com.edge.odometry;

import com.edge.odometry.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OdometryApplication {

    public static void main(String[] args) {
        // OpenCV 必须在容器创建任何 Mat 之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(OdometryApplication.class, args);
    }
}
