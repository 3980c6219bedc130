package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.channel.SecureChannelEnvelope;
import cardsdk.tlv.Tlv;
import cardsdk.tlv.TlvDecoder;

import net.sf.scuba.smartcards.ResponseAPDU;

import java.util.List;

/** Raw card response; the payload may still be encrypted. */
public final class ResponseApdu {

  private final int sw;
  private final byte[] data;

  public ResponseApdu(int sw, byte[] data) {
    this.sw = sw & 0xFFFF;
    this.data = data != null ? data.clone() : new byte[0];
  }

  public static ResponseApdu from(ResponseAPDU response) {
    return new ResponseApdu(response.getSW(), response.getData());
  }

  public int getSw() {
    return sw;
  }

  public StatusWord getStatusWord() {
    return StatusWord.fromCode(sw);
  }

  public byte[] getData() {
    return data.clone();
  }

  /** Decrypts the payload with {@code envelope} and parses it as a TLV sequence. */
  public List<Tlv> getTlvData(SecureChannelEnvelope envelope) throws CardSdkException {
    return Tlv.deserialize(envelope.unprotect(data));
  }

  public TlvDecoder decoder(SecureChannelEnvelope envelope) throws CardSdkException {
    return new TlvDecoder(getTlvData(envelope));
  }

  @Override
  public String toString() {
    return String.format("ResponseApdu(SW=%04X, %d bytes)", sw, data.length);
  }
}
