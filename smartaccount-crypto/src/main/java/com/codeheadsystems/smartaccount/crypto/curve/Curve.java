package com.codeheadsystems.smartaccount.crypto.curve;

import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Domain parameters of a named curve, with the half-order used for low-s normalization.
 */
public record Curve(ECDomainParameters params, ECCurve curve, ECPoint g, BigInteger n, BigInteger halfN) {

  public static final Curve SECP256K1_CURVE = loadCurve("secp256k1");

  public Curve(ECDomainParameters params) {
    this(params, params.getCurve(), params.getG(), params.getN(), params.getN().shiftRight(1));
  }

  /**
   * The field prime; x-coordinates at or above it cannot be lifted back to a point.
   */
  public BigInteger fieldPrime() {
    return curve.getField().getCharacteristic();
  }

  private static Curve loadCurve(String name) {
    X9ECParameters params = CustomNamedCurves.getByName(name);
    if (params == null) {
      throw new IllegalArgumentException("Unsupported curve: " + name);
    }
    return new Curve(new ECDomainParameters(
        params.getCurve(),
        params.getG(),
        params.getN(),
        params.getH()
    ));
  }

}
