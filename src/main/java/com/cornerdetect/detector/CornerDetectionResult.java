package com.cornerdetect.detector;

import com.cornerdetect.ANMS.AnmsResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kết quả của toàn bộ pipeline: bản đồ phản hồi Harris (để hiển thị bên ngoài nếu cần) và các góc đã chọn.
 */
@AllArgsConstructor
@Getter
public class CornerDetectionResult {
    private final double[][] response;
    private final AnmsResult corners;
}
