package sivantoledo.estimators.kalman;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import sivantoledo.estimators.EstimationException;
import sivantoledo.estimators.linalg.LinearAlgebra;

/**
 * The Rauch-Tung-Striebel backward recursion over a sequence of filter steps.
 *
 * The recursion starts from the newest filtered estimate, which is also its
 * smoothed estimate, and moves back:
 *   C[t]  = Pf[t] * F[t+1]' * inv(Pp[t+1])
 *   xs[t] = xf[t] + C[t]*(xs[t+1] - xp[t+1])
 *   Ps[t] = Pf[t] + C[t]*(Ps[t+1] - Pp[t+1])*C[t]'
 * where f denotes filtered, p predicted and s smoothed quantities. A singular
 * predicted covariance is replaced by its pseudo-inverse.
 *
 * @author Sivan Toledo
 */
public final class RauchTungStriebel {

  private final static Logger log = LogManager.getLogger();

  private RauchTungStriebel() {}

  /**
   * Smooths a sequence of consecutive filter steps.
   *
   * @param entries the steps, oldest first
   * @return the same steps, each carrying its smoothed estimate
   */
  public static List<LagEntry> smooth(List<LagEntry> entries) {
    int n = entries.size();
    LagEntry[] out = new LagEntry[n];
    if (n == 0) return new ArrayList<>();

    LagEntry newest = entries.get(n-1);
    out[n-1] = newest.withSmoothed(newest.filtered());

    for (int t=n-2; t>=0; t--) {
      LagEntry   e    = entries.get(t);
      LagEntry   next = entries.get(t+1);
      KalmanState sNext = out[t+1].smoothed();

      RealMatrix Pf = e.filtered().covariance();
      RealMatrix Pp = next.prior().covariance();
      RealMatrix C  = Pf.multiply(next.transition().transpose()).multiply(invert(Pp, next.prior().stateIndex()));

      RealVector x = e.filtered().state().add(C.operate(sNext.state().subtract(next.prior().state())));
      RealMatrix P = Pf.add(C.multiply(sNext.covariance().subtract(Pp)).multiply(C.transpose()));

      KalmanState f = e.filtered();
      KalmanState s = new KalmanState(f.stateIndex(), f.eventTime(), x, LinearAlgebra.symmetrize(P),
                                      f.residual(), f.residualCovariance(), f.slidingLogLikelihoods());
      out[t] = e.withSmoothed(s);
    }
    return new ArrayList<>(Arrays.asList(out));
  }

  private static RealMatrix invert(RealMatrix P, long index) {
    try {
      return LinearAlgebra.inverse(P);
    } catch (EstimationException singular) {
      log.warn("predicted covariance of step {} is singular, smoothing with its pseudo-inverse", index);
      return LinearAlgebra.pseudoInverse(P);
    }
  }
}
