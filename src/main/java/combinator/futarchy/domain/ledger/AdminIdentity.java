package combinator.futarchy.domain.ledger;

/**
 * 시스템이 서명 키를 관리하는 원장 계정
 *
 * @param keyIndex 키 서비스 인덱스
 * @param address 공개 주소
 */
public record AdminIdentity(int keyIndex, String address) {}
