package combinator.futarchy.service.readiness;

/**
 * 준비 상태 검사
 *
 * <p>구현체는 {@code @Order}로 실행 순서를 정합니다. 비용이 낮은(원격 호출이 없는) 검사가 앞에 오며, 뒤쪽 검사는 앞 검사가 통과했다고
 * 가정할 수 있습니다.
 */
public interface ReadinessCheck {

  String name();

  /** 이 조직에 적용되는 검사인지 (예: 풀 일치 검사는 루트 전용) */
  default boolean appliesTo(ReadinessContext context) {
    return true;
  }

  ReadinessResult check(ReadinessContext context);
}
