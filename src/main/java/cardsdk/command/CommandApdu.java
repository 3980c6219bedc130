package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.channel.SecureChannelEnvelope;
import cardsdk.tlv.Tlv;
import cardsdk.tlv.TlvBuilder;

import net.sf.scuba.smartcards.CommandAPDU;

import java.util.List;
import java.util.Objects;

/** Request before it is put on the wire: an instruction plus its serialized TLV payload. */
public final class CommandApdu {

  static final int CLA = 0x00;

  private final Instruction instruction;
  private final byte[] data;

  public CommandApdu(Instruction instruction, byte[] data) {
    this.instruction = Objects.requireNonNull(instruction, "instruction");
    this.data = Objects.requireNonNull(data, "data").clone();
  }

  public static CommandApdu of(Instruction instruction, TlvBuilder builder) throws CardSdkException {
    return new CommandApdu(instruction, builder.serialize());
  }

  public static CommandApdu of(Instruction instruction, List<Tlv> tlvs) throws CardSdkException {
    return new CommandApdu(instruction, Tlv.serialize(tlvs));
  }

  public Instruction getInstruction() {
    return instruction;
  }

  public byte[] getData() {
    return data.clone();
  }

  /** Wraps the payload in {@code envelope} and carries its mode in P1. */
  public CommandAPDU encode(SecureChannelEnvelope envelope) throws CardSdkException {
    byte[] payload = envelope.protect(data);
    int p1 = envelope.getMode().getByteValue();
    if (payload.length == 0) {
      return new CommandAPDU(CLA, instruction.getCode(), p1, 0x00);
    }
    return new CommandAPDU(CLA, instruction.getCode(), p1, 0x00, payload);
  }

  @Override
  public String toString() {
    return "CommandApdu(" + instruction + ", " + data.length + " bytes)";
  }
}
