package com.codeheadsystems.smartaccount.crypto.ecdsa;

import com.codeheadsystems.smartaccount.crypto.Keccak;
import com.codeheadsystems.smartaccount.crypto.common.RandomProvider;
import com.codeheadsystems.smartaccount.crypto.curve.Curve;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Recoverable ECDSA over secp256k1.
 * <p>
 * Signing uses deterministic nonces (RFC 6979) and always produces low-s signatures.
 * Recovery rejects high-s signatures so that a signature has exactly one accepted encoding.
 */
public class Secp256k1 {

  private static final Curve CURVE = Curve.SECP256K1_CURVE;
  private static final X9IntegerConverter X9 = new X9IntegerConverter();

  private Secp256k1() {
  }

  /**
   * A private key with its public point and derived address.
   *
   * @param privateKey the private scalar
   * @param publicKey  the public point
   * @param address    keccak-derived 20-byte address of the public key
   */
  public record KeyPair(BigInteger privateKey, ECPoint publicKey, Address address) {
  }

  /**
   * Derives the key pair for a known private scalar.
   *
   * @param privateKey the private key, 0 &lt; key &lt; n
   * @return the key pair
   */
  public static KeyPair keyPair(BigInteger privateKey) {
    if (privateKey.signum() <= 0 || privateKey.compareTo(CURVE.n()) >= 0) {
      throw new IllegalArgumentException("Private key out of range");
    }
    ECPoint publicKey = CURVE.g().multiply(privateKey).normalize();
    return new KeyPair(privateKey, publicKey, addressOf(publicKey));
  }

  /**
   * Generates a fresh random key pair.
   *
   * @param randomProvider the random source
   * @return the key pair
   */
  public static KeyPair generate(RandomProvider randomProvider) {
    BigInteger candidate;
    do {
      candidate = new BigInteger(1, randomProvider.randomBytes(32));
    } while (candidate.signum() == 0 || candidate.compareTo(CURVE.n()) >= 0);
    return keyPair(candidate);
  }

  /**
   * The address of a public key: the last 20 bytes of keccak256 over the uncompressed point
   * without its 0x04 prefix.
   *
   * @param publicKey the public key
   * @return the address
   */
  public static Address addressOf(ECPoint publicKey) {
    byte[] encoded = publicKey.normalize().getEncoded(false);
    byte[] hash = Keccak.keccak256(Arrays.copyOfRange(encoded, 1, encoded.length));
    return new Address(Arrays.copyOfRange(hash, hash.length - Address.LENGTH, hash.length));
  }

  /**
   * Signs a 32-byte digest.
   *
   * @param digest  the digest
   * @param keyPair the signing key
   * @return the recoverable signature
   */
  public static EcdsaSignature sign(Hash32 digest, KeyPair keyPair) {
    byte[] hash = digest.bytes();
    ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
    signer.init(true, new ECPrivateKeyParameters(keyPair.privateKey(), CURVE.params()));
    BigInteger[] components = signer.generateSignature(hash);
    BigInteger r = components[0];
    BigInteger s = components[1];
    if (s.compareTo(CURVE.halfN()) > 0) {
      s = CURVE.n().subtract(s);
    }
    for (int recId = 0; recId < 2; recId++) {
      ECPoint candidate = recoverPoint(recId, r, s, hash);
      if (candidate != null && candidate.equals(keyPair.publicKey())) {
        return new EcdsaSignature(r, s, recId + 27);
      }
    }
    throw new IllegalStateException("Could not construct a recoverable signature");
  }

  /**
   * Recovers the signer address from a digest and signature.
   *
   * @param digest    the digest that was signed
   * @param signature the signature
   * @return the signer, or empty when the signature is malformed or non-canonical
   */
  public static Optional<Address> recover(Hash32 digest, EcdsaSignature signature) {
    BigInteger r = signature.r();
    BigInteger s = signature.s();
    int recId = signature.recoveryId();
    if (recId < 0 || recId > 1
        || r.signum() <= 0 || r.compareTo(CURVE.n()) >= 0
        || s.signum() <= 0 || s.compareTo(CURVE.halfN()) > 0) {
      return Optional.empty();
    }
    ECPoint point = recoverPoint(recId, r, s, digest.bytes());
    if (point == null || point.isInfinity()) {
      return Optional.empty();
    }
    return Optional.of(addressOf(point));
  }

  /**
   * Recovers the signer from a 65-byte encoded signature; malformed encodings yield empty.
   *
   * @param digest         the digest that was signed
   * @param signatureBytes the encoded signature
   * @return the signer, or empty
   */
  public static Optional<Address> recover(Hash32 digest, byte[] signatureBytes) {
    if (signatureBytes == null || signatureBytes.length != EcdsaSignature.LENGTH) {
      return Optional.empty();
    }
    return recover(digest, EcdsaSignature.fromBytes(signatureBytes));
  }

  // SEC 1 v2 §4.1.6 public key recovery.
  private static ECPoint recoverPoint(int recId, BigInteger r, BigInteger s, byte[] hash) {
    BigInteger n = CURVE.n();
    BigInteger x = r.add(BigInteger.valueOf(recId / 2).multiply(n));
    if (x.compareTo(CURVE.fieldPrime()) >= 0) {
      return null;
    }
    byte[] compressed = X9.integerToBytes(x, 1 + X9.getByteLength(CURVE.curve()));
    compressed[0] = (byte) ((recId & 1) == 1 ? 0x03 : 0x02);
    ECPoint bigR;
    try {
      bigR = CURVE.curve().decodePoint(compressed);
    } catch (IllegalArgumentException notOnCurve) {
      // x is not on the curve
      return null;
    }
    if (!bigR.multiply(n).isInfinity()) {
      return null;
    }
    BigInteger e = new BigInteger(1, hash);
    BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
    BigInteger rInv = r.modInverse(n);
    BigInteger srInv = rInv.multiply(s).mod(n);
    BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
    return ECAlgorithms.sumOfTwoMultiplies(CURVE.g(), eInvrInv, bigR, srInv).normalize();
  }
}
