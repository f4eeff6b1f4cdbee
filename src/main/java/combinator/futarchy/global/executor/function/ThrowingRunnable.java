package combinator.futarchy.global.executor.function;

@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
