package combinator.futarchy.global.executor.function;

/** 예외를 던질 수 있는 Supplier (원격 호출·서명 작업용) */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
