package cardsdk.command;

import cardsdk.CardSdkException;

import net.sf.scuba.smartcards.CommandAPDU;
import net.sf.scuba.smartcards.ResponseAPDU;

/** Exchanges APDUs with one card. Not safe for concurrent use. */
public interface CardTransport extends AutoCloseable {

  ResponseAPDU transceive(CommandAPDU apdu) throws CardSdkException;

  /** Called when the flow has no hardware work for a while, e.g. while waiting on the network. */
  void pause();

  void resume();

  @Override
  void close();
}
