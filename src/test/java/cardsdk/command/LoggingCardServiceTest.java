package cardsdk.command;

import cardsdk.LogCategory;
import cardsdk.SdkEvents;

import net.sf.scuba.smartcards.CommandAPDU;
import net.sf.scuba.smartcards.ResponseAPDU;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingCardServiceTest {

  @Test
  void logsEachExchange() throws Exception {
    List<String> lines = new ArrayList<>();
    SdkEvents events = new SdkEvents() {
      @Override
      public void onLog(LogCategory category, String message) {
        if (category == LogCategory.APDU) {
          lines.add(message);
        }
      }
    };
    LoggingCardService service = new LoggingCardService(new EmulatedCard(), events);
    service.open();

    ResponseAPDU response = service.transmit(new CommandAPDU(0x00, Instruction.READ.getCode(), 0x00, 0x00));

    assertEquals(0x6A86, response.getSW());
    assertEquals(2, lines.size());
    assertTrue(lines.get(0).startsWith("-> READ INS=F2 P1=00"), lines.get(0));
    assertTrue(lines.get(1).startsWith("<- SW=6A86 (INVALID_PARAMS)"), lines.get(1));
    assertTrue(service.isOpen());
  }
}
