package uibridge.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShutdownSignalTest {

  @Test
  void startsUncancelled() {
    assertFalse(new ShutdownSignal().isCancelled());
  }

  @Test
  void cancelReportsOnlyTheFirstTransition() {
    ShutdownSignal signal = new ShutdownSignal();

    assertTrue(signal.cancel());
    assertFalse(signal.cancel());
    assertTrue(signal.isCancelled());
  }

  @Test
  void independentSignalsDoNotInterfere() {
    ShutdownSignal a = new ShutdownSignal();
    ShutdownSignal b = new ShutdownSignal();

    a.cancel();

    assertTrue(a.isCancelled());
    assertFalse(b.isCancelled());
  }
}
