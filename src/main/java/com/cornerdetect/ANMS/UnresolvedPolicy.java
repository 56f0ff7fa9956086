package com.cornerdetect.ANMS;

/**
 * Cách xử lý ứng viên mà tìm kiếm kd-tree không gặp lân cận nào mạnh hơn đáng kể.
 */
public enum UnresolvedPolicy {
    /** Bỏ hẳn điểm đó khỏi kết quả (hành vi gốc của biến thể kd-tree). */
    OMIT,
    /** Gán bán kính rmax giống biến thể brute force. */
    SENTINEL
}
