package cardsdk;

public enum LogCategory {
  GENERAL,
  APDU,
  SECURITY,
  ATTESTATION,
  NETWORK
}
