package br.lncc.dfense.helper;

import static org.junit.Assert.assertEquals;

import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.ejml.ops.MatrixFeatures;
import org.junit.Test;

public class LeastSquaresProjectorTest {

  @Test
  public void testProjectionIsIdempotent() {
    DenseMatrix64F p = LeastSquaresProjector.polynomial(7, 2).projection();
    DenseMatrix64F pp = new DenseMatrix64F(7, 7);
    CommonOps.mult(p, p, pp);
    assertEquals(true, MatrixFeatures.isEquals(p, pp, 1e-10));
    assertEquals(true, MatrixFeatures.isSymmetric(p, 1e-10));
    // trace equals the number of fitted parameters
    assertEquals(3.0, CommonOps.trace(p), 1e-10);
  }

  @Test
  public void testLineFit() {
    LeastSquaresProjector projector = new LeastSquaresProjector(3, 2);
    for (int i = 0; i < 3; i++) {
      projector.setObservation(i, 0, 1.0);
      projector.setObservation(i, 1, i);
    }
    DenseMatrix64F p = projector.projection();
    double[] y = {1, 4, 2};
    double fitted0 = 0.0;
    for (int k = 0; k < 3; k++) {
      fitted0 += p.get(0, k) * y[k];
    }
    // intercept 11/6, slope 1/2
    assertEquals(11 / 6.0, fitted0, 1e-12);
  }

  @Test(expected = IllegalStateException.class)
  public void testRankDeficient() {
    LeastSquaresProjector projector = new LeastSquaresProjector(3, 2);
    for (int i = 0; i < 3; i++) {
      projector.setObservation(i, 0, 1.0);
    }
    // second column left at zero
    projector.projection();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMoreFeaturesThanRows() {
    new LeastSquaresProjector(2, 3);
  }
}
