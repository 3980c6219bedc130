package cardsdk.tlv;

import cardsdk.CardSdkException;
import cardsdk.SdkError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates records in append order. A {@code null} value is skipped, which is how
 * optional request fields are left out.
 */
public final class TlvBuilder {

  private final List<Tlv> tlvs = new ArrayList<>();

  public TlvBuilder append(TlvTag tag, Object value) throws CardSdkException {
    if (value == null) {
      return this;
    }
    return add(TlvEncoder.encode(tag, value));
  }

  /** Appends an already encoded record, enforcing the single-value rule of its tag. */
  public TlvBuilder add(Tlv tlv) throws CardSdkException {
    TlvTag tag = tlv.getTag();
    if (!tag.isMultiValued() && contains(tlv.getTagCode())) {
      throw new CardSdkException(SdkError.DUPLICATE_TAG, tag + " may appear only once");
    }
    tlvs.add(tlv);
    return this;
  }

  public boolean contains(TlvTag tag) {
    return contains(tag.getCode());
  }

  private boolean contains(int tagCode) {
    for (Tlv tlv : tlvs) {
      if (tlv.getTagCode() == tagCode) {
        return true;
      }
    }
    return false;
  }

  public List<Tlv> build() {
    return Collections.unmodifiableList(new ArrayList<>(tlvs));
  }

  public byte[] serialize() throws CardSdkException {
    return Tlv.serialize(tlvs);
  }
}
