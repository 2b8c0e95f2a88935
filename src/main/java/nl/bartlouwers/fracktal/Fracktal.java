package nl.bartlouwers.fracktal;

import java.util.List;

/**
 * Interface for FRACKTAL symbolic compression operations.
 */
public interface Fracktal {

  /**
   * Encode text into a reversible symbolic codex.
   * 
   * @param input The text to encode, possibly empty
   * @return Codex containing chunks, symbols, pattern dictionary and fingerprint
   */
  Codex encode(String input);

  /**
   * Encode binary data. Every byte becomes one unit of the symbolic stream.
   * 
   * @param data The input data to encode
   * @return Codex for the data, decodable with {@link #decodeBytes(Codex)}
   */
  Codex encode(byte[] data);

  /**
   * Encode several inputs. The returned list is in input order.
   * 
   * @param inputs The texts to encode
   * @return One codex per input
   */
  List<Codex> encodeAll(List<String> inputs);

  /**
   * Decode a codex back into the exact text it was encoded from.
   * 
   * @param codex The codex to decode
   * @return The original text
   * @throws DecodeException if the codex is inconsistent or references an unknown pattern
   */
  String decode(Codex codex);

  /**
   * Decode a codex produced by {@link #encode(byte[])}.
   * 
   * @param codex The codex to decode
   * @return The original data
   * @throws DecodeException if the codex is inconsistent or holds non-byte units
   */
  byte[] decodeBytes(Codex codex);

  /**
   * Decode a codex, then check its stored fingerprint against one recomputed
   * from the decoded symbol stream.
   * 
   * @param codex The codex to decode
   * @return The original text
   * @throws DecodeException if the codex cannot be decoded
   * @throws IntegrityException if the fingerprints differ
   */
  String decodeVerified(Codex codex);

  /**
   * Content fingerprint of a codex.
   * 
   * @param codex The codex
   * @return 64 character hex SHA-256 fingerprint
   */
  String fingerprint(Codex codex);
}
