package com.ryuqq.discovery.core.model;

/**
 * 단계(Stage) 사이, 그리고 반복(iteration) 사이에 전달되는 불투명 데이터.
 *
 * <p>코어는 Payload의 내용을 해석하지 않습니다. 논문 목록, 분석 결과, 가설 목록 등
 * 실제 형식은 협력자(Collaborator)끼리 정한 JSON 계약을 따릅니다.</p>
 *
 * @param json JSON 텍스트 (빈 문자열 허용, null은 빈 문자열로 정규화)
 * @author Discovery Team
 * @since 1.0.0
 */
public record Payload(String json) {

    private static final Payload EMPTY = new Payload("");

    public Payload {
        json = json == null ? "" : json;
    }

    /**
     * Payload 생성.
     *
     * @param json JSON 텍스트
     * @return Payload 인스턴스
     */
    public static Payload of(String json) {
        return new Payload(json);
    }

    /**
     * 빈 Payload.
     *
     * @return 첫 반복의 첫 단계 입력처럼 앞선 결과가 없을 때 쓰는 빈 Payload
     */
    public static Payload empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return json.isEmpty();
    }
}
