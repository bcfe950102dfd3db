package com.swissdraw.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class SwissPairingException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public SwissPairingException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static SwissPairingException invalidMatch(String detail) {
        return new SwissPairingException(
                HttpStatus.BAD_REQUEST,
                "invalid_match",
                detail
        );
    }

    public static SwissPairingException rematch(String detail) {
        return new SwissPairingException(
                HttpStatus.CONFLICT,
                "rematch",
                detail
        );
    }

    public static SwissPairingException noEligiblePlayerForBye(String detail) {
        return new SwissPairingException(
                HttpStatus.CONFLICT,
                "no_eligible_player_for_bye",
                detail
        );
    }

    public static SwissPairingException pairingConflict(String detail) {
        return new SwissPairingException(
                HttpStatus.CONFLICT,
                "pairing_conflict",
                detail
        );
    }

    public static SwissPairingException byeAlreadyAwarded(String detail) {
        return new SwissPairingException(
                HttpStatus.CONFLICT,
                "bye_already_awarded",
                detail
        );
    }
}
