package sivantoledo.estimators.mixture;

/**
 * One sample for a keyed mixture estimator. The first input of a key may
 * carry the initial mixture of that key, replacing the configured one.
 */
public final class MixtureInput<S, C extends MixtureComponent<S, C>> {

  private final S                  sample;
  private final MixtureModel<S, C> initialModel; // may be null

  private MixtureInput(S sample, MixtureModel<S, C> initialModel) {
    this.sample       = sample;
    this.initialModel = initialModel;
  }

  public static <S, C extends MixtureComponent<S, C>> MixtureInput<S, C> of(S sample) {
    return new MixtureInput<>(sample, null);
  }

  public static <S, C extends MixtureComponent<S, C>> MixtureInput<S, C> of(S sample, MixtureModel<S, C> initialModel) {
    return new MixtureInput<>(sample, initialModel);
  }

  public S                  sample()       { return sample; }
  public MixtureModel<S, C> initialModel() { return initialModel; }
}
