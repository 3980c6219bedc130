package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.card.CardStatus;
import cardsdk.card.SettingsMask;
import cardsdk.channel.EncryptionMode;
import cardsdk.channel.SecureChannelEnvelope;
import cardsdk.crypto.CryptoUtils;
import cardsdk.crypto.EllipticCurve;
import cardsdk.crypto.RawKeyPair;
import cardsdk.tlv.Tlv;
import cardsdk.tlv.TlvBuilder;
import cardsdk.tlv.TlvDecoder;
import cardsdk.tlv.TlvTag;

import net.sf.scuba.smartcards.CardService;
import net.sf.scuba.smartcards.CardServiceException;
import net.sf.scuba.smartcards.CommandAPDU;
import net.sf.scuba.smartcards.ResponseAPDU;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * In-memory card speaking the TLV protocol. Requests are parsed with the SDK's own codec
 * and answered with signatures made by freshly generated keys.
 */
public final class EmulatedCard extends CardService {

  public static final String CARD_ID = "CB79000000018201";
  public static final String BATCH_ID = "0027";
  public static final String ISSUER_NAME = "TANGEM SDK";

  private static final int SW_SUCCESS = 0x9000;

  private final RawKeyPair cardKeys;
  private final RawKeyPair issuerKeys;
  private final List<Wallet> wallets = new ArrayList<>();
  private final List<byte[]> linkedCardKeys = new ArrayList<>();
  private final Deque<Integer> queuedStatusWords = new ArrayDeque<>();
  private final List<Instruction> received = new ArrayList<>();

  private String firmwareVersion = "4.52r";
  private CardStatus status = CardStatus.LOADED;
  private SettingsMask settingsMask = SettingsMask.of(SettingsMask.Flag.IS_REUSABLE);
  private boolean activated = true;
  private int emptyWalletSlots;
  private byte[] accessCode = UserCode.defaultCode(UserCode.Type.ACCESS_CODE).getValue();
  private boolean tamperCardSignature;
  private int tamperWalletIndex = -1;
  private byte[] sessionKey;
  private byte[] issuerData;
  private byte[] issuerDataSignature;
  private Integer issuerDataCounter;
  private boolean open;

  public EmulatedCard() throws CardSdkException {
    this.cardKeys = CryptoUtils.generateKeyPair(EllipticCurve.SECP256K1);
    this.issuerKeys = CryptoUtils.generateKeyPair(EllipticCurve.SECP256K1);
  }

  public static final class Wallet {
    final int index;
    final RawKeyPair keys;
    final EllipticCurve curve;
    final Integer signedHashes;
    int attestCounter;

    Wallet(int index, RawKeyPair keys, EllipticCurve curve, Integer signedHashes, int attestCounter) {
      this.index = index;
      this.keys = keys;
      this.curve = curve;
      this.signedHashes = signedHashes;
      this.attestCounter = attestCounter;
    }

    public byte[] getPublicKey() {
      return keys.getPublicKey();
    }
  }

  public EmulatedCard firmware(String value) {
    this.firmwareVersion = value;
    return this;
  }

  public EmulatedCard status(CardStatus value) {
    this.status = value;
    return this;
  }

  public EmulatedCard settings(SettingsMask.Flag... flags) {
    this.settingsMask = SettingsMask.of(flags);
    return this;
  }

  public EmulatedCard activated(boolean value) {
    this.activated = value;
    return this;
  }

  public EmulatedCard accessCode(String code) {
    this.accessCode = UserCode.of(UserCode.Type.ACCESS_CODE, code).getValue();
    return this;
  }

  public EmulatedCard tamperCardSignature(boolean value) {
    this.tamperCardSignature = value;
    return this;
  }

  public EmulatedCard tamperWalletSignature(int walletIndex) {
    this.tamperWalletIndex = walletIndex;
    return this;
  }

  /** From now on plaintext requests are refused with {@code NEED_ENCRYPTION}. */
  public EmulatedCard requireEncryption(byte[] key) {
    this.sessionKey = key.clone();
    return this;
  }

  public EmulatedCard emptyWalletSlots(int count) {
    this.emptyWalletSlots = count;
    return this;
  }

  public Wallet addWallet(EllipticCurve curve, Integer signedHashes, int attestCounter) throws CardSdkException {
    Wallet wallet = new Wallet(wallets.size(), CryptoUtils.generateKeyPair(curve), curve, signedHashes, attestCounter);
    wallets.add(wallet);
    return wallet;
  }

  public EmulatedCard addLinkedCardKey(byte[] publicKey) {
    linkedCardKeys.add(publicKey.clone());
    return this;
  }

  /** Next requests are answered with these status words, one per request, before normal handling resumes. */
  public EmulatedCard queueStatusWords(int... statusWords) {
    for (int sw : statusWords) {
      queuedStatusWords.add(sw);
    }
    return this;
  }

  public byte[] getCardPublicKey() {
    return cardKeys.getPublicKey();
  }

  public byte[] getIssuerPublicKey() {
    return issuerKeys.getPublicKey();
  }

  public List<Wallet> getWallets() {
    return Collections.unmodifiableList(wallets);
  }

  public List<Instruction> getReceived() {
    return Collections.unmodifiableList(received);
  }

  public Integer getIssuerDataCounter() {
    return issuerDataCounter;
  }

  public byte[] getIssuerData() {
    return issuerData != null ? issuerData.clone() : null;
  }

  public byte[] signIssuerData(byte[] data, Integer counter) throws CardSdkException {
    return CryptoUtils.sign(EllipticCurve.SECP256K1, issuerKeys.getPrivateKey(),
        IssuerDataVerifier.message(CARD_ID, data, counter));
  }

  @Override
  public void open() {
    open = true;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    open = false;
  }

  @Override
  public boolean isConnectionLost(Exception e) {
    return false;
  }

  @Override
  public byte[] getATR() {
    return new byte[]{0x3B, (byte) 0x80, (byte) 0x80, 0x01, 0x01};
  }

  public boolean isExtendedAPDULengthSupported() {
    return true;
  }

  @Override
  public ResponseAPDU transmit(CommandAPDU apdu) throws CardServiceException {
    Instruction instruction = Instruction.fromCode(apdu.getINS() & 0xFF);
    received.add(instruction);
    if (!queuedStatusWords.isEmpty()) {
      return respond(queuedStatusWords.poll(), new byte[0]);
    }
    try {
      SecureChannelEnvelope envelope = SecureChannelEnvelope.plain();
      if (sessionKey != null) {
        if (apdu.getP1() == EncryptionMode.NONE.getByteValue()) {
          return respond(StatusWord.NEED_ENCRYPTION.getCode(), new byte[0]);
        }
        envelope = SecureChannelEnvelope.of(modeOf(apdu.getP1()), sessionKey);
      }
      TlvDecoder request = new TlvDecoder(Tlv.deserialize(envelope.unprotect(apdu.getData())));
      if (!Arrays.equals(accessCode, request.decodeOptional(TlvTag.ACCESS_CODE, byte[].class))) {
        return respond(StatusWord.INVALID_PARAMS.getCode(), new byte[0]);
      }
      TlvBuilder response = new TlvBuilder();
      int sw = handle(instruction, request, response);
      byte[] payload = sw == SW_SUCCESS ? envelope.protect(response.serialize()) : new byte[0];
      return respond(sw, payload);
    } catch (CardSdkException e) {
      throw new CardServiceException("Emulated card failed: " + e.getMessage());
    }
  }

  private int handle(Instruction instruction, TlvDecoder request, TlvBuilder response) throws CardSdkException {
    if (instruction == null) {
      return StatusWord.INS_NOT_SUPPORTED.getCode();
    }
    switch (instruction) {
      case READ:
        return request.contains(TlvTag.WALLET_INDEX) ? readWallet(request, response) : read(response);
      case ATTEST_CARD_KEY:
        return attestCardKey(request, response);
      case ATTEST_WALLET_KEY:
        return attestWalletKey(request, response);
      case WRITE_ISSUER_DATA:
        return writeIssuerData(request, response);
      case READ_ISSUER_DATA:
        return readIssuerData(response);
      default:
        return StatusWord.INS_NOT_SUPPORTED.getCode();
    }
  }

  private int read(TlvBuilder response) throws CardSdkException {
    response.append(TlvTag.CARD_ID, CARD_ID)
        .append(TlvTag.STATUS, status)
        .append(TlvTag.FIRMWARE_VERSION, firmwareVersion);
    if (status == CardStatus.NOT_PERSONALIZED) {
      return SW_SUCCESS;
    }
    List<Tlv> cardData = new TlvBuilder()
        .append(TlvTag.BATCH_ID, BATCH_ID)
        .append(TlvTag.MANUFACTURE_DATE_TIME, LocalDate.of(2021, 6, 16))
        .append(TlvTag.ISSUER_NAME, ISSUER_NAME)
        .build();
    response.append(TlvTag.CARD_PUBLIC_KEY, cardKeys.getPublicKey())
        .append(TlvTag.SETTINGS_MASK, settingsMask)
        .append(TlvTag.ISSUER_DATA_PUBLIC_KEY, issuerKeys.getPublicKey())
        .append(TlvTag.IS_ACTIVATED, activated)
        .append(TlvTag.WALLETS_COUNT, wallets.size() + emptyWalletSlots)
        .append(TlvTag.CARD_DATA, cardData);
    return SW_SUCCESS;
  }

  private int readWallet(TlvDecoder request, TlvBuilder response) throws CardSdkException {
    int index = request.decode(TlvTag.WALLET_INDEX, Integer.class);
    if (index >= wallets.size()) {
      return StatusWord.WALLET_NOT_FOUND.getCode();
    }
    Wallet wallet = wallets.get(index);
    response.append(TlvTag.WALLET_INDEX, wallet.index)
        .append(TlvTag.WALLET_PUBLIC_KEY, wallet.keys.getPublicKey())
        .append(TlvTag.CURVE_ID, wallet.curve)
        .append(TlvTag.WALLET_SIGNED_HASHES, wallet.signedHashes);
    return SW_SUCCESS;
  }

  private int attestCardKey(TlvDecoder request, TlvBuilder response) throws CardSdkException {
    byte[] challenge = request.decode(TlvTag.CHALLENGE, byte[].class);
    byte[] salt = CryptoUtils.generateRandomBytes(16);
    boolean full = request.contains(TlvTag.INTERACTION_MODE);
    ByteArrayOutputStream message = new ByteArrayOutputStream();
    message.writeBytes(challenge);
    message.writeBytes(salt);
    if (full && !linkedCardKeys.isEmpty()) {
      message.writeBytes("BACKUP_CARDS".getBytes(StandardCharsets.UTF_8));
      linkedCardKeys.forEach(message::writeBytes);
    }
    byte[] signature = CryptoUtils.sign(EllipticCurve.SECP256K1, cardKeys.getPrivateKey(), message.toByteArray());
    if (tamperCardSignature) {
      signature[5] ^= 0x01;
    }
    response.append(TlvTag.CARD_ID, CARD_ID)
        .append(TlvTag.SALT, salt)
        .append(TlvTag.CARD_SIGNATURE, signature);
    if (full) {
      for (byte[] key : linkedCardKeys) {
        response.append(TlvTag.BACKUP_CARD_PUBLIC_KEY, key);
      }
    }
    return SW_SUCCESS;
  }

  private int attestWalletKey(TlvDecoder request, TlvBuilder response) throws CardSdkException {
    byte[] publicKey = request.decode(TlvTag.WALLET_PUBLIC_KEY, byte[].class);
    Wallet wallet = null;
    for (Wallet candidate : wallets) {
      if (Arrays.equals(candidate.keys.getPublicKey(), publicKey)) {
        wallet = candidate;
      }
    }
    if (wallet == null) {
      return StatusWord.WALLET_NOT_FOUND.getCode();
    }
    byte[] challenge = request.decode(TlvTag.CHALLENGE, byte[].class);
    byte[] salt = CryptoUtils.generateRandomBytes(16);
    byte[] message = new byte[challenge.length + salt.length];
    System.arraycopy(challenge, 0, message, 0, challenge.length);
    System.arraycopy(salt, 0, message, challenge.length, salt.length);
    byte[] signature = CryptoUtils.sign(wallet.curve, wallet.keys.getPrivateKey(), message);
    if (wallet.index == tamperWalletIndex) {
      signature[5] ^= 0x01;
    }
    wallet.attestCounter++;
    response.append(TlvTag.CARD_ID, CARD_ID)
        .append(TlvTag.SALT, salt)
        .append(TlvTag.WALLET_SIGNATURE, signature)
        .append(TlvTag.CHECK_WALLET_COUNTER, wallet.attestCounter);
    return SW_SUCCESS;
  }

  private int writeIssuerData(TlvDecoder request, TlvBuilder response) throws CardSdkException {
    Integer counter = request.decodeOptional(TlvTag.ISSUER_DATA_COUNTER, Integer.class);
    if (settingsMask.contains(SettingsMask.Flag.PROTECT_ISSUER_DATA_AGAINST_REPLAY)
        && (counter == null || (issuerDataCounter != null && counter <= issuerDataCounter))) {
      return StatusWord.INVALID_PARAMS.getCode();
    }
    issuerData = request.decode(TlvTag.ISSUER_DATA, byte[].class);
    issuerDataSignature = request.decode(TlvTag.ISSUER_DATA_SIGNATURE, byte[].class);
    issuerDataCounter = counter;
    response.append(TlvTag.CARD_ID, CARD_ID);
    return SW_SUCCESS;
  }

  private int readIssuerData(TlvBuilder response) throws CardSdkException {
    if (issuerData == null) {
      return StatusWord.FILE_NOT_FOUND.getCode();
    }
    response.append(TlvTag.CARD_ID, CARD_ID)
        .append(TlvTag.ISSUER_DATA, issuerData)
        .append(TlvTag.ISSUER_DATA_SIGNATURE, issuerDataSignature)
        .append(TlvTag.ISSUER_DATA_COUNTER, issuerDataCounter);
    return SW_SUCCESS;
  }

  private static EncryptionMode modeOf(int p1) {
    for (EncryptionMode mode : EncryptionMode.values()) {
      if (mode.getByteValue() == p1) {
        return mode;
      }
    }
    return EncryptionMode.NONE;
  }

  private static ResponseAPDU respond(int sw, byte[] data) {
    byte[] raw = Arrays.copyOf(data, data.length + 2);
    raw[data.length] = (byte) (sw >> 8);
    raw[data.length + 1] = (byte) sw;
    return new ResponseAPDU(raw);
  }
}
