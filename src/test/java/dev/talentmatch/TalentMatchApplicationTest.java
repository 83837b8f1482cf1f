package dev.talentmatch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TalentMatchApplicationTest {

  @Mock
  private ScreeningRunner screeningRunner;

  @Test
  void shouldRunScreeningAndExitSuccessfully() {
    TalentMatchApplication app = new TalentMatchApplication(screeningRunner);

    when(screeningRunner.execute()).thenReturn(1);

    app.run();

    verify(screeningRunner).execute();
    assertEquals(0, app.getExitCode());
  }

  @Test
  void shouldHandleExceptionAndExitWithError() {
    TalentMatchApplication app = new TalentMatchApplication(screeningRunner);

    when(screeningRunner.execute()).thenThrow(new IllegalStateException("Fatal"));

    app.run();

    assertEquals(1, app.getExitCode());
  }
}
