package cardsdk.card;

import cardsdk.attestation.Attestation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a card as read by the preflight read. Instances are immutable; the session
 * replaces its card record with updated copies.
 */
public final class Card {

  private final String cardId;
  private final byte[] cardPublicKey;
  private final FirmwareVersion firmwareVersion;
  private final CardStatus status;
  private final SettingsMask settingsMask;
  private final byte[] issuerDataPublicKey;
  private final boolean activated;
  private final String batchId;
  private final LocalDate manufactureDate;
  private final String issuerName;
  private final int walletsCount;
  private final List<CardWallet> wallets;
  private final Attestation attestation;

  private Card(Builder builder) {
    this.cardId = Objects.requireNonNull(builder.cardId, "cardId");
    this.cardPublicKey = Objects.requireNonNull(builder.cardPublicKey, "cardPublicKey").clone();
    this.firmwareVersion = Objects.requireNonNull(builder.firmwareVersion, "firmwareVersion");
    this.status = builder.status;
    this.settingsMask = builder.settingsMask;
    this.issuerDataPublicKey = builder.issuerDataPublicKey != null ? builder.issuerDataPublicKey.clone() : null;
    this.activated = builder.activated;
    this.batchId = builder.batchId;
    this.manufactureDate = builder.manufactureDate;
    this.issuerName = builder.issuerName;
    this.walletsCount = builder.walletsCount;
    this.wallets = Collections.unmodifiableList(new ArrayList<>(builder.wallets));
    this.attestation = builder.attestation != null ? builder.attestation : Attestation.EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getCardId() {
    return cardId;
  }

  public byte[] getCardPublicKey() {
    return cardPublicKey.clone();
  }

  public FirmwareVersion getFirmwareVersion() {
    return firmwareVersion;
  }

  public boolean isDevelopmentCard() {
    return firmwareVersion.isDevelopment();
  }

  public CardStatus getStatus() {
    return status;
  }

  public SettingsMask getSettingsMask() {
    return settingsMask;
  }

  public boolean hasSetting(SettingsMask.Flag flag) {
    return settingsMask != null && settingsMask.contains(flag);
  }

  public byte[] getIssuerDataPublicKey() {
    return issuerDataPublicKey != null ? issuerDataPublicKey.clone() : null;
  }

  public boolean isActivated() {
    return activated;
  }

  public String getBatchId() {
    return batchId;
  }

  public LocalDate getManufactureDate() {
    return manufactureDate;
  }

  public String getIssuerName() {
    return issuerName;
  }

  public int getWalletsCount() {
    return walletsCount;
  }

  public List<CardWallet> getWallets() {
    return wallets;
  }

  public CardWallet findWallet(byte[] publicKey) {
    for (CardWallet wallet : wallets) {
      if (Arrays.equals(wallet.getPublicKey(), publicKey)) {
        return wallet;
      }
    }
    return null;
  }

  public Attestation getAttestation() {
    return attestation;
  }

  public Card withAttestation(Attestation value) {
    Builder builder = toBuilder();
    builder.attestation = value;
    return builder.build();
  }

  public Card withWallets(List<CardWallet> value) {
    return toBuilder().wallets(value).build();
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.cardId = cardId;
    builder.cardPublicKey = cardPublicKey;
    builder.firmwareVersion = firmwareVersion;
    builder.status = status;
    builder.settingsMask = settingsMask;
    builder.issuerDataPublicKey = issuerDataPublicKey;
    builder.activated = activated;
    builder.batchId = batchId;
    builder.manufactureDate = manufactureDate;
    builder.issuerName = issuerName;
    builder.walletsCount = walletsCount;
    builder.wallets = new ArrayList<>(wallets);
    builder.attestation = attestation;
    return builder;
  }

  @Override
  public String toString() {
    return "Card[" + cardId + ", fw=" + firmwareVersion + ", status=" + status
        + ", wallets=" + wallets.size() + ", attestation=" + attestation + "]";
  }

  public static final class Builder {
    String cardId;
    byte[] cardPublicKey;
    FirmwareVersion firmwareVersion;
    CardStatus status;
    SettingsMask settingsMask;
    byte[] issuerDataPublicKey;
    boolean activated;
    String batchId;
    LocalDate manufactureDate;
    String issuerName;
    int walletsCount;
    List<CardWallet> wallets = new ArrayList<>();
    Attestation attestation;

    public Builder cardId(String value) {
      this.cardId = value;
      return this;
    }

    public Builder cardPublicKey(byte[] value) {
      this.cardPublicKey = value;
      return this;
    }

    public Builder firmwareVersion(FirmwareVersion value) {
      this.firmwareVersion = value;
      return this;
    }

    public Builder status(CardStatus value) {
      this.status = value;
      return this;
    }

    public Builder settingsMask(SettingsMask value) {
      this.settingsMask = value;
      return this;
    }

    public Builder issuerDataPublicKey(byte[] value) {
      this.issuerDataPublicKey = value;
      return this;
    }

    public Builder activated(boolean value) {
      this.activated = value;
      return this;
    }

    public Builder batchId(String value) {
      this.batchId = value;
      return this;
    }

    public Builder manufactureDate(LocalDate value) {
      this.manufactureDate = value;
      return this;
    }

    public Builder issuerName(String value) {
      this.issuerName = value;
      return this;
    }

    public Builder walletsCount(int value) {
      this.walletsCount = value;
      return this;
    }

    public Builder wallets(List<CardWallet> value) {
      this.wallets = new ArrayList<>(value);
      return this;
    }

    public Builder addWallet(CardWallet value) {
      if (value != null) {
        this.wallets.add(value);
      }
      return this;
    }

    public Builder attestation(Attestation value) {
      this.attestation = value;
      return this;
    }

    public Card build() {
      return new Card(this);
    }
  }
}
