package com.cornerdetect.ANMS;

public class AnmsConfig {
    // Giá trị mặc định của ANMS
    public static final int DEFAULT_N = 100;            // số góc trả về
    public static final double DEFAULT_C = 0.9;         // tỉ lệ "mạnh hơn đáng kể": h_i < c * h_k
    public static final int DEFAULT_EDGE = 10;          // dải biên bị cắt trước khi dùng kd-tree
    public static final boolean DEFAULT_USE_THRESHOLD = true; // ngưỡng mean + std, ngược lại min(H)

    // Bước k đầu tiên của tìm kiếm lân cận tăng dần (k = 1 chỉ trả về chính điểm đó)
    public static final int KD_TREE_FIRST_K = 2;
}
