package com.cornerdetect.exception;

/**
 * Lỗi cấu hình / lập trình: tham số không hợp lệ (chế độ biên lạ, kernel chẵn, sigma <= 0 ...).
 * Không retry, ném thẳng lên cho bên gọi.
 */
public class InvalidParameterException extends IllegalArgumentException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
