package combinator.futarchy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 오케스트레이터 외부 설정 프로퍼티
 *
 * <p>{@code @ConfigurationProperties} + {@code @Validated}로 타입 안전 바인딩합니다. 기본값은 운영 값과 같으며
 * application.yml에서 덮어쓸 수 있습니다.
 */
@Validated
@ConfigurationProperties(prefix = "futarchy")
public class FutarchyProperties {

  @NotNull @Valid private Ledger ledger = new Ledger();
  @NotNull @Valid private LookupTable lookupTable = new LookupTable();
  @NotNull @Valid private Readiness readiness = new Readiness();
  @NotNull @Valid private Proposal proposal = new Proposal();
  @NotNull @Valid private Liquidity liquidity = new Liquidity();
  @NotNull @Valid private Organization organization = new Organization();
  @NotNull @Valid private Cache cache = new Cache();
  @NotNull @Valid private Lock lock = new Lock();

  public Ledger getLedger() {
    return ledger;
  }

  public void setLedger(Ledger ledger) {
    this.ledger = ledger;
  }

  public LookupTable getLookupTable() {
    return lookupTable;
  }

  public void setLookupTable(LookupTable lookupTable) {
    this.lookupTable = lookupTable;
  }

  public Readiness getReadiness() {
    return readiness;
  }

  public void setReadiness(Readiness readiness) {
    this.readiness = readiness;
  }

  public Proposal getProposal() {
    return proposal;
  }

  public void setProposal(Proposal proposal) {
    this.proposal = proposal;
  }

  public Liquidity getLiquidity() {
    return liquidity;
  }

  public void setLiquidity(Liquidity liquidity) {
    this.liquidity = liquidity;
  }

  public Organization getOrganization() {
    return organization;
  }

  public void setOrganization(Organization organization) {
    this.organization = organization;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Lock getLock() {
    return lock;
  }

  public void setLock(Lock lock) {
    this.lock = lock;
  }

  /** 원장 제출·확정 설정 */
  public static class Ledger {

    /** 제출 1건당 확정 대기 상한 */
    @NotNull private Duration confirmTimeout = Duration.ofSeconds(60);

    /** 읽기 요청 최대 시도 횟수 (최초 1회 + 재시도) */
    @Min(1)
    @Max(5)
    private int readMaxAttempts = 2;

    @NotNull private Duration readRetryInterval = Duration.ofMillis(200);

    /** 확정된 변경이 조회에 반영될 때까지의 재조회 간격과 상한 */
    @NotNull private Duration visibilityPollInterval = Duration.ofMillis(500);

    @NotNull private Duration visibilityMaxWait = Duration.ofSeconds(10);

    public Duration getVisibilityPollInterval() {
      return visibilityPollInterval;
    }

    public void setVisibilityPollInterval(Duration visibilityPollInterval) {
      this.visibilityPollInterval = visibilityPollInterval;
    }

    public Duration getVisibilityMaxWait() {
      return visibilityMaxWait;
    }

    public void setVisibilityMaxWait(Duration visibilityMaxWait) {
      this.visibilityMaxWait = visibilityMaxWait;
    }

    public Duration getConfirmTimeout() {
      return confirmTimeout;
    }

    public void setConfirmTimeout(Duration confirmTimeout) {
      this.confirmTimeout = confirmTimeout;
    }

    public int getReadMaxAttempts() {
      return readMaxAttempts;
    }

    public void setReadMaxAttempts(int readMaxAttempts) {
      this.readMaxAttempts = readMaxAttempts;
    }

    public Duration getReadRetryInterval() {
      return readRetryInterval;
    }

    public void setReadRetryInterval(Duration readRetryInterval) {
      this.readRetryInterval = readRetryInterval;
    }
  }

  /** 주소 압축 테이블 준비 대기 */
  public static class LookupTable {

    @NotNull private Duration pollInterval = Duration.ofMillis(500);
    @NotNull private Duration maxWait = Duration.ofSeconds(10);

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public Duration getMaxWait() {
      return maxWait;
    }

    public void setMaxWait(Duration maxWait) {
      this.maxWait = maxWait;
    }
  }

  public static class Readiness {

    /** 관리자 지갑 최소 보유 수수료 자산 (기본 단위, 0.1 SOL) */
    @NotNull private BigInteger minAdminNativeBalance = BigInteger.valueOf(100_000_000L);

    public BigInteger getMinAdminNativeBalance() {
      return minAdminNativeBalance;
    }

    public void setMinAdminNativeBalance(BigInteger minAdminNativeBalance) {
      this.minAdminNativeBalance = minAdminNativeBalance;
    }
  }

  /** 제안 생성 파라미터 */
  public static class Proposal {

    @Min(0)
    @Max(100)
    private int maxObservationDeltaPercent = 5;

    @Min(0)
    @Max(10000)
    private int feeBps = 50;

    @Min(0)
    @Max(100)
    private int marketBias = 0;

    /** 래핑 시 수량에 더하는 여유분 (기본 단위) */
    @NotNull private BigInteger wrapBuffer = BigInteger.valueOf(10_000L);

    @NotNull private Duration ownerMinLength = Duration.ofMinutes(1);
    @NotNull private Duration ownerMaxLength = Duration.ofDays(7);
    @NotNull private Duration proposerMinLength = Duration.ofDays(1);
    @NotNull private Duration proposerMaxLength = Duration.ofDays(4);

    public int getMaxObservationDeltaPercent() {
      return maxObservationDeltaPercent;
    }

    public void setMaxObservationDeltaPercent(int maxObservationDeltaPercent) {
      this.maxObservationDeltaPercent = maxObservationDeltaPercent;
    }

    public int getFeeBps() {
      return feeBps;
    }

    public void setFeeBps(int feeBps) {
      this.feeBps = feeBps;
    }

    public int getMarketBias() {
      return marketBias;
    }

    public void setMarketBias(int marketBias) {
      this.marketBias = marketBias;
    }

    public BigInteger getWrapBuffer() {
      return wrapBuffer;
    }

    public void setWrapBuffer(BigInteger wrapBuffer) {
      this.wrapBuffer = wrapBuffer;
    }

    public Duration getOwnerMinLength() {
      return ownerMinLength;
    }

    public void setOwnerMinLength(Duration ownerMinLength) {
      this.ownerMinLength = ownerMinLength;
    }

    public Duration getOwnerMaxLength() {
      return ownerMaxLength;
    }

    public void setOwnerMaxLength(Duration ownerMaxLength) {
      this.ownerMaxLength = ownerMaxLength;
    }

    public Duration getProposerMinLength() {
      return proposerMinLength;
    }

    public void setProposerMinLength(Duration proposerMinLength) {
      this.proposerMinLength = proposerMinLength;
    }

    public Duration getProposerMaxLength() {
      return proposerMaxLength;
    }

    public void setProposerMaxLength(Duration proposerMaxLength) {
      this.proposerMaxLength = proposerMaxLength;
    }
  }

  public static class Liquidity {

    /** 재예치를 수행할 최소 보유 비율 (총 공급량 대비 bps) */
    @Min(0)
    @Max(10000)
    private int returnThresholdBps = 50;

    public int getReturnThresholdBps() {
      return returnThresholdBps;
    }

    public void setReturnThresholdBps(int returnThresholdBps) {
      this.returnThresholdBps = returnThresholdBps;
    }
  }

  public static class Organization {

    @Min(5)
    @Max(50)
    private int defaultWithdrawalPercentage = 12;

    /** 루트 조직 풀의 최소 수수료 (bps) */
    @Min(0)
    @Max(10000)
    private int minPoolFeeBps = 63;

    public int getDefaultWithdrawalPercentage() {
      return defaultWithdrawalPercentage;
    }

    public void setDefaultWithdrawalPercentage(int defaultWithdrawalPercentage) {
      this.defaultWithdrawalPercentage = defaultWithdrawalPercentage;
    }

    public int getMinPoolFeeBps() {
      return minPoolFeeBps;
    }

    public void setMinPoolFeeBps(int minPoolFeeBps) {
      this.minPoolFeeBps = minPoolFeeBps;
    }
  }

  public static class Cache {

    /** 목록성 집계 조회 TTL */
    @NotNull private Duration listTtl = Duration.ofSeconds(30);

    @Min(100)
    @Max(1_000_000)
    private long maximumSize = 10_000;

    public Duration getListTtl() {
      return listTtl;
    }

    public void setListTtl(Duration listTtl) {
      this.listTtl = listTtl;
    }

    public long getMaximumSize() {
      return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
      this.maximumSize = maximumSize;
    }
  }

  public static class Lock {

    @NotNull private Duration waitTimeout = Duration.ofMinutes(5);

    public Duration getWaitTimeout() {
      return waitTimeout;
    }

    public void setWaitTimeout(Duration waitTimeout) {
      this.waitTimeout = waitTimeout;
    }
  }
}
