package xyz.firestige.binder.exception;

/**
 * 在步骤边界观察到取消信号
 */
public class DeployCancelledException extends BinderException {

    public DeployCancelledException(String nextStep) {
        super(ErrorType.DEPLOY_CANCELLED, "deploy cancelled before step " + nextStep);
    }
}
