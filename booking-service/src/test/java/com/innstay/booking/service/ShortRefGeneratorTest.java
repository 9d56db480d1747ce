package com.innstay.booking.service;

import com.innstay.booking.repository.BookingRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class ShortRefGeneratorTest {

    private static final Locale DEFAULT_LOCALE = Locale.getDefault();

    @InjectMocks
    private ShortRefGenerator shortRefGenerator;

    @Mock
    private BookingRepository bookingRepository;

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(DEFAULT_LOCALE);
    }

    @Test
    void normalize_turkishDefaultLocale_uppercasesLatinI() {
        Locale.setDefault(new Locale("tr", "TR"));

        assertThat(ShortRefGenerator.normalize("  is-7k2qmi ")).isEqualTo("IS-7K2QMI");
    }

    @Test
    void normalize_null_returnsNull() {
        assertThat(ShortRefGenerator.normalize(null)).isNull();
    }

    @Test
    void generate_unused_returnsPrefixedRefFromReadableAlphabet() {
        given(bookingRepository.existsByShortRef(anyString())).willReturn(false);

        assertThat(shortRefGenerator.generate()).matches("IS-[A-HJ-NP-Z2-9]{6}");
    }

    @Test
    void generate_everyCandidateTaken_throwsIllegalState() {
        given(bookingRepository.existsByShortRef(anyString())).willReturn(true);

        assertThatThrownBy(() -> shortRefGenerator.generate())
                .isInstanceOf(IllegalStateException.class);
    }
}
