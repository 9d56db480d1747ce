package com.innstay.booking.service;

import com.innstay.booking.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;

/**
 * Guest-facing booking references such as {@code IS-7K2QMP}. The alphabet
 * leaves out 0/O and 1/I so references survive being read over the phone.
 */
@Component
@RequiredArgsConstructor
public class ShortRefGenerator {

    static final String PREFIX = "IS-";
    private static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int LENGTH = 6;
    private static final int MAX_ATTEMPTS = 5;

    private final BookingRepository bookingRepository;
    private final SecureRandom random = new SecureRandom();

    public String generate() {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = randomRef();
            if (!bookingRepository.existsByShortRef(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a unique booking reference");
    }

    public static String normalize(String shortRef) {
        return shortRef == null ? null : shortRef.trim().toUpperCase(Locale.ROOT);
    }

    private String randomRef() {
        StringBuilder ref = new StringBuilder(PREFIX);
        for (int i = 0; i < LENGTH; i++) {
            ref.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return ref.toString();
    }
}
