package com.sparta.reward.common.exception;

/**
 * 에러 코드 정의
 */
public enum ErrorCode {
    // 보상 테이블 관련 에러
    R001("R001", "보상 데이터 설정이 올바르지 않습니다"),
    R002("R002", "보상 데이터 전개 깊이를 초과했습니다"),
    R003("R003", "보상 지급 조건을 만족하지 않습니다"),

    // 인벤토리 관련 에러
    I001("I001", "인벤토리가 가득 찼습니다"),
    I002("I002", "유효하지 않은 아이템 수량입니다"),
    I003("I003", "아이템을 찾을 수 없습니다"),

    // 가챠 관련 에러
    G001("G001", "가챠 캠페인을 찾을 수 없습니다"),

    // 재화 관련 에러
    CUR001("CUR001", "재화가 부족합니다"),

    // 공통 에러
    COMMON001("COMMON001", "필수 파라미터가 누락되었습니다"),
    COMMON002("COMMON002", "잘못된 요청 형식입니다"),
    COMMON004("COMMON004", "서버 내부 오류가 발생했습니다"),
    COMMON005("COMMON005", "요청 처리 중입니다. 잠시 후 다시 시도해주세요");

    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
