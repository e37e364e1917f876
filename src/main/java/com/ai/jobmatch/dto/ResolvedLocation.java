package com.ai.jobmatch.dto;

import lombok.Value;

/**
 * 위치 문자열을 행정 코드로 해석한 결과. 검색 변형마다 하나씩 만들어지고 저장되지 않는다.
 */
@Value
public class ResolvedLocation {

    public enum Kind { REGION, DEPARTMENT, COMMUNE, NONE }

    private static final ResolvedLocation NONE = new ResolvedLocation(Kind.NONE, null, null);

    Kind kind;
    String code;
    // 코뮌일 때만: 상위 데파르트망 코드 (캐스케이드 검색용)
    String parentDepartmentCode;

    public static ResolvedLocation none() {
        return NONE;
    }

    public static ResolvedLocation region(String code) {
        return new ResolvedLocation(Kind.REGION, code, null);
    }

    public static ResolvedLocation department(String code) {
        return new ResolvedLocation(Kind.DEPARTMENT, code, null);
    }

    public static ResolvedLocation commune(String code, String parentDepartmentCode) {
        return new ResolvedLocation(Kind.COMMUNE, code, parentDepartmentCode);
    }

    public boolean isResolved() {
        return kind != Kind.NONE;
    }
}
