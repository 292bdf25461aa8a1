package uk.gegc.docintake;

import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Common base for Mockito-powered unit tests.
 */
@ExtendWith(MockitoExtension.class)
public abstract class BaseUnitTest {
}
