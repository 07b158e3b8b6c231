package com.edge.odometry.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI edgeOdometryOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Odometry API")
                        .description("""
                                视觉里程计 API 文档

                                ## 功能概述

                                估计两帧校正后灰度图像之间的二维平移，不依赖特征点或光流。

                                ### 算法
                                - **随机块采样**：在较晚的帧中随机选取位置、尺寸都随机的块
                                - **模板匹配**：在较早的帧中用归一化相关系数定位每个块
                                - **投票**：票数最多的位移即为结果，票数占比为置信度
                                - **递归加码**：置信度不超过阈值时增加试验次数重试，直到上限

                                ### API 响应格式
                                所有接口返回统一的 JSON 格式：
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为 POST 接口统一补充 400 响应说明
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().putIfAbsent("400", createBadRequestResponse());
            }
        });
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("frame1 must not be empty")
        ));

        return new ApiResponse()
                .description("请求错误")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
