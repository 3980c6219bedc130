package cardsdk.command;

import cardsdk.LogCategory;
import cardsdk.SdkEvents;

import net.sf.scuba.smartcards.CardService;
import net.sf.scuba.smartcards.CardServiceException;
import net.sf.scuba.smartcards.CommandAPDU;
import net.sf.scuba.smartcards.ResponseAPDU;

/**
 * Decorator that reports APDU traffic to {@link SdkEvents}.
 */
public final class LoggingCardService extends CardService {

  private final CardService delegate;
  private final SdkEvents events;

  public LoggingCardService(CardService delegate, SdkEvents events) {
    this.delegate = delegate;
    this.events = events != null ? events : SdkEvents.none();
  }

  @Override
  public void open() throws CardServiceException {
    delegate.open();
  }

  @Override
  public boolean isOpen() {
    return delegate.isOpen();
  }

  @Override
  public void close() {
    delegate.close();
  }

  @Override
  public boolean isConnectionLost(Exception e) {
    try {
      return delegate.isConnectionLost(e);
    } catch (AbstractMethodError error) {
      // Services built against older scuba releases lack this hook.
      return false;
    }
  }

  @Override
  public byte[] getATR() throws CardServiceException {
    return delegate.getATR();
  }

  // Not annotated: only some scuba releases declare this hook.
  public boolean isExtendedAPDULengthSupported() {
    return true;
  }

  @Override
  public ResponseAPDU transmit(CommandAPDU apdu) throws CardServiceException {
    Instruction instruction = Instruction.fromCode(apdu.getINS() & 0xFF);
    events.onLog(LogCategory.APDU, String.format(
        "-> %s INS=%02X P1=%02X Lc=%d%s",
        instruction != null ? instruction : "?",
        apdu.getINS() & 0xFF,
        apdu.getP1() & 0xFF,
        apdu.getNc(),
        apdu.getP1() != 0 ? " [encrypted]" : ""));
    ResponseAPDU response = delegate.transmit(apdu);
    events.onLog(LogCategory.APDU, String.format(
        "<- SW=%04X (%s) dataLen=%d",
        response.getSW(),
        StatusWord.fromCode(response.getSW()),
        response.getData().length));
    return response;
  }

  @Override
  public String toString() {
    return "LoggingCardService(" + delegate + ")";
  }
}
