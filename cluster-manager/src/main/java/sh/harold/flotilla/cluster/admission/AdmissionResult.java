package sh.harold.flotilla.cluster.admission;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an admission request, with the message answered to the requesting user.
 */
public final class AdmissionResult {
    private final LaunchedInstance launched;
    private final AdmissionRejection rejection;
    private final String message;

    private AdmissionResult(LaunchedInstance launched, AdmissionRejection rejection, String message) {
        this.launched = launched;
        this.rejection = rejection;
        this.message = Objects.requireNonNull(message, "message");
    }

    public static AdmissionResult admitted(LaunchedInstance launched, String message) {
        return new AdmissionResult(Objects.requireNonNull(launched, "launched"), null, message);
    }

    public static AdmissionResult rejected(AdmissionRejection rejection, String message) {
        return new AdmissionResult(null, Objects.requireNonNull(rejection, "rejection"), message);
    }

    public boolean isAdmitted() {
        return launched != null;
    }

    public Optional<LaunchedInstance> launched() {
        return Optional.ofNullable(launched);
    }

    public Optional<AdmissionRejection> rejection() {
        return Optional.ofNullable(rejection);
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return isAdmitted() ? "admitted(" + launched.instance() + ")" : "rejected(" + rejection + ": " + message + ")";
    }
}
