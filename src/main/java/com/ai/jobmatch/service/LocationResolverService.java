package com.ai.jobmatch.service;

import com.ai.jobmatch.dto.LocationType;
import com.ai.jobmatch.dto.ResolvedLocation;

public interface LocationResolverService {

    /**
     * 위치 문자열을 레지옹/데파르트망/코뮌 코드로 해석한다.
     * 해석에 실패해도 예외를 던지지 않고 {@link ResolvedLocation#none()}을 반환한다 (지역 조건 없음).
     */
    ResolvedLocation resolve(String raw, LocationType hint);
}
