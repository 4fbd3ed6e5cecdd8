package minikv.utils;

public class Time {
    public interface Clock {
        long currentTimeMillis();
    }

    public static final Clock SYSTEM_CLOCK = System::currentTimeMillis;

    private Time() {
    }
}
