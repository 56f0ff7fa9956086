package com.cornerdetect.filter_convolution_gauss;

import com.cornerdetect.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Cách sinh các pixel nằm ngoài ảnh khi kernel chạm biên.
 */
public enum BoundaryMode {
    /** Chỉ tính ở phần trong, dải biên rộng r giữ giá trị 0. */
    VALID,
    /** Đệm bằng một hằng số fill. */
    FILL,
    /** Lặp lại pixel cạnh gần nhất (clamp). */
    EXTEND,
    /** Phản xạ qua biên, không lặp lại pixel biên: -1 -> 1, -2 -> 2. */
    MIRROR,
    /** Quấn vòng (torus) theo cả hai trục, kể cả 4 góc. */
    WRAP;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BoundaryMode fromString(String mode) {
        if (mode != null) {
            for (BoundaryMode m : values()) {
                if (m.key().equals(mode.trim().toLowerCase(Locale.ROOT))) return m;
            }
        }
        throw new InvalidParameterException("invalid boundary mode: " + mode);
    }

    /**
     * Ánh xạ chỉ số i (có thể nằm ngoài [0, size)) về chỉ số nguồn trong ảnh.
     * Chỉ dùng cho EXTEND, MIRROR, WRAP.
     */
    int sourceIndex(int i, int size) {
        switch (this) {
            case EXTEND:
                return Math.max(0, Math.min(i, size - 1));
            case MIRROR: {
                if (size == 1) return 0;
                int period = 2 * (size - 1);
                int m = Math.floorMod(i, period);
                return m < size ? m : period - m;
            }
            case WRAP:
                return Math.floorMod(i, size);
            default:
                throw new IllegalStateException("Không có ánh xạ chỉ số cho chế độ " + this);
        }
    }
}
