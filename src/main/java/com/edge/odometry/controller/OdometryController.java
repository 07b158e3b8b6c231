package com.edge.odometry.controller;

import com.edge.odometry.core.odometry.model.Estimate;
import com.edge.odometry.dto.MovementRequest;
import com.edge.odometry.dto.MovementResponse;
import com.edge.odometry.service.OdometryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 视觉里程计控制器
 * <p>
 * 接收两帧亮度数组，返回平移估计及置信度
 */
@RestController
@RequestMapping("/api/odometry")
@Tag(name = "视觉里程计", description = "基于递归蒙特卡洛块匹配的两帧平移估计")
public class OdometryController {
    private static final Logger logger = LoggerFactory.getLogger(OdometryController.class);

    @Autowired
    private OdometryService odometryService;

    /**
     * 估计两帧之间的平移
     */
    @PostMapping("/movement")
    @Operation(
            summary = "估计两帧之间的平移",
            description = """
                    从较晚的帧 frame2 中随机采样多个块，在较早的帧 frame1 中做模板匹配，
                    以票数最多的位移作为结果。置信度不超过阈值时自动增加试验次数重试，直到达到上限。

                    **请求字段说明**：
                    | 字段 | 类型 | 说明 |
                    |------|------|------|
                    | frame1 | number[][] | 较早的帧，frame[row][col]，宽高均需大于 5 |
                    | frame2 | number[][] | 较晚的帧 |
                    | maxIntensity | number | 可选，亮度上限，默认 255；0..1 的小数帧传 1 |
                    | seed | number | 可选，随机种子 |
                    | confidenceThreshold | number | 可选，置信度阈值，默认 0.4 |
                    | initialTrials | number | 可选，首轮试验数，默认 4 |
                    | trialIncrement | number | 可选，每轮增加的试验数，默认 4 |
                    | maxTrials | number | 可选，试验数上限，默认 50 |

                    **返回字段说明**：
                    - dx / dy：frame1 中的匹配位置减去 frame2 中的块位置（列、行）
                    - confidence：与结果一致的试验占比
                    - trials：最后一轮的试验数
                    - accepted：置信度是否超过阈值
                    """
    )
    @io.swagger.v3.oas.annotations.parameters.RequestBody(
            description = "两帧亮度数组及可选参数",
            required = true,
            content = @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = MovementRequest.class)
            )
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "估计成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "dx": 3,
                                                "dy": -2,
                                                "confidence": 0.75,
                                                "trials": 4,
                                                "rounds": 1,
                                                "accepted": true,
                                                "processingTimeMs": 12
                                              }
                                            }
                                            """
                            )
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "帧尺寸或参数不合法",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "error",
                                              "message": "Frame 5x5 is too small to sample, width and height must both exceed 5"
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> estimateMovement(@RequestBody MovementRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            Estimate estimate = odometryService.estimateMovement(request);
            response.put("status", "success");
            response.put("data", MovementResponse.from(estimate));
            if (!estimate.isAccepted()) {
                response.put("message", "置信度未超过阈值，返回最后一轮的结果");
            }
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid movement request: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
        } catch (Exception e) {
            logger.error("Failed to estimate movement", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 获取当前估计参数
     */
    @GetMapping("/config")
    @Operation(summary = "获取当前估计参数", description = "返回阈值、试验次数、相关度量、并行度等当前生效的配置")
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", odometryService.getCurrentConfig());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to get config", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }
}
