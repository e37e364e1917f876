package com.ai.jobmatch.dto;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * 검색 요청 한 건의 지역 조건. commune, department, region 중 하나만 채워지거나 모두 비어 있다(전국).
 */
@Value
public class LocationConstraint {

    public static final String PARIS_COMMUNE_CODE = "75056";
    public static final String PARIS_DEPARTMENT_CODE = "75";

    private static final Pattern TWO_DIGITS = Pattern.compile("\\d{2}");
    private static final LocationConstraint NATIONAL = new LocationConstraint(null, null, null, null);

    String communeCode;
    String departmentCode;
    String regionCode;
    // commune 검색일 때만 의미 있음, null이면 기본 반경
    Integer radiusKm;

    public static LocationConstraint national() {
        return NATIONAL;
    }

    public static LocationConstraint commune(String code) {
        return new LocationConstraint(code, null, null, null);
    }

    public static LocationConstraint commune(String code, Integer radiusKm) {
        return new LocationConstraint(code, null, null, radiusKm);
    }

    public static LocationConstraint department(String code) {
        return new LocationConstraint(null, code, null, null);
    }

    public static LocationConstraint region(String code) {
        return new LocationConstraint(null, null, code, null);
    }

    public static LocationConstraint from(ResolvedLocation location) {
        if (location == null) {
            return NATIONAL;
        }
        return switch (location.getKind()) {
            case REGION -> region(location.getCode());
            case DEPARTMENT -> department(location.getCode());
            case COMMUNE -> commune(location.getCode());
            case NONE -> NATIONAL;
        };
    }

    /**
     * 실제로 전송되는 형태로 변환한다.
     * 파리(75056, 75로 시작하는 구 코드)는 commune+반경 검색 결과가 적어 데파르트망 75로 바꾸고,
     * commune 자리에 들어온 두 자리 숫자는 데파르트망 코드로 보낸다.
     */
    public LocationConstraint normalized() {
        if (communeCode == null) {
            return this;
        }
        if (PARIS_COMMUNE_CODE.equals(communeCode) || communeCode.startsWith(PARIS_DEPARTMENT_CODE)) {
            return department(PARIS_DEPARTMENT_CODE);
        }
        if (TWO_DIGITS.matcher(communeCode).matches()) {
            return department(communeCode);
        }
        return this;
    }

    public boolean isNational() {
        return communeCode == null && departmentCode == null && regionCode == null;
    }

    public boolean isDepartmentScoped() {
        return departmentCode != null;
    }
}
