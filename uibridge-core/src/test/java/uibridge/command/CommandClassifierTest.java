package uibridge.command;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandClassifierTest {

  @Test
  void sampleCoversEveryKind() {
    Set<CommandKind> sampled = SampleCommands.oneOfEach().stream()
        .map(UiCommand::kind)
        .collect(Collectors.toSet());

    assertEquals(EnumSet.allOf(CommandKind.class), sampled);
  }

  @Test
  void onlyResizeScrollAndDragAreDroppable() {
    Set<CommandKind> droppable = SampleCommands.oneOfEach().stream()
        .filter(CommandClassifier::isDroppable)
        .map(UiCommand::kind)
        .collect(Collectors.toSet());

    assertEquals(EnumSet.of(CommandKind.RESIZE, CommandKind.SCROLL, CommandKind.DRAG), droppable);
  }

  @Test
  void everyKindHasDeliveryClassAndFailurePolicy() {
    for (CommandKind kind : CommandKind.values()) {
      assertTrue(kind.deliveryClass() != null, kind + " has no delivery class");
      assertTrue(kind.failurePolicy() != null, kind + " has no failure policy");
    }
  }

  @Test
  void classificationIgnoresPayload() {
    assertEquals(DeliveryClass.DROPPABLE, CommandClassifier.classify(new UiCommand.Resize(0, 0)));
    assertEquals(DeliveryClass.DROPPABLE, CommandClassifier.classify(new UiCommand.Resize(5000, 5000)));
    assertEquals(DeliveryClass.GUARANTEED, CommandClassifier.classify(new UiCommand.Keyboard("")));
    assertEquals(DeliveryClass.GUARANTEED, CommandClassifier.classify(new UiCommand.Keyboard("<Esc>:wq<CR>")));
  }

  @Test
  void classificationIsStable() {
    for (UiCommand command : SampleCommands.oneOfEach()) {
      DeliveryClass first = CommandClassifier.classify(command);
      for (int i = 0; i < 100; i++) {
        assertEquals(first, CommandClassifier.classify(command));
      }
    }
  }

  @Test
  void guaranteedKindsIncludeQuitFocusAndFileDrop() {
    assertFalse(CommandClassifier.isDroppable(new UiCommand.Quit()));
    assertFalse(CommandClassifier.isDroppable(new UiCommand.FocusLost()));
    assertFalse(CommandClassifier.isDroppable(new UiCommand.FocusGained()));
    assertFalse(CommandClassifier.isDroppable(new UiCommand.FileDrop("a.txt")));
  }

  @Test
  void nullCommandThrows() {
    assertThrows(NullPointerException.class, () -> CommandClassifier.classify(null));
  }
}
