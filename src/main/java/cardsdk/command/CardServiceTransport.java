package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.LogCategory;
import cardsdk.SdkError;
import cardsdk.SdkEvents;

import net.sf.scuba.smartcards.CardService;
import net.sf.scuba.smartcards.CardServiceException;
import net.sf.scuba.smartcards.CommandAPDU;
import net.sf.scuba.smartcards.ResponseAPDU;

import java.util.Objects;

/**
 * {@link CardTransport} over a scuba {@link CardService}. The service is opened on first
 * use; a pause closes it and the next exchange opens it again. All methods synchronize on
 * the transport since pauses may come from callback threads.
 */
public final class CardServiceTransport implements CardTransport {

  private final CardService service;
  private final SdkEvents events;
  private boolean paused;

  public CardServiceTransport(CardService service, SdkEvents events) {
    this.events = events != null ? events : SdkEvents.none();
    this.service = new LoggingCardService(Objects.requireNonNull(service, "service"), this.events);
  }

  @Override
  public synchronized ResponseAPDU transceive(CommandAPDU apdu) throws CardSdkException {
    try {
      if (paused) {
        resume();
      }
      if (!service.isOpen()) {
        service.open();
      }
      return service.transmit(apdu);
    } catch (CardServiceException e) {
      if (service.isConnectionLost(e)) {
        events.onLog(LogCategory.GENERAL, "Connection to card lost: " + e.getMessage());
      }
      throw new CardSdkException(SdkError.TRANSPORT_FAILED, "APDU exchange failed: " + e.getMessage(), e);
    }
  }

  @Override
  public synchronized void pause() {
    if (!paused) {
      paused = true;
      if (service.isOpen()) {
        service.close();
      }
      events.onLog(LogCategory.GENERAL, "Transport paused");
    }
  }

  @Override
  public synchronized void resume() {
    if (paused) {
      paused = false;
      events.onLog(LogCategory.GENERAL, "Transport resumed");
    }
  }

  public synchronized boolean isPaused() {
    return paused;
  }

  @Override
  public synchronized void close() {
    if (service.isOpen()) {
      service.close();
    }
  }
}
