package com.typepulse.anomaly.service;

import com.typepulse.anomaly.detection.AntiCheatValidator;
import com.typepulse.anomaly.detection.ChallengePhrases;
import com.typepulse.anomaly.detection.RaceSubmissionValidator;
import com.typepulse.anomaly.model.AntiCheatResult;
import com.typepulse.anomaly.model.ChallengeOutcome;
import com.typepulse.anomaly.model.KeystrokeTimings;
import com.typepulse.anomaly.model.SubmissionContext;
import com.typepulse.anomaly.model.SubmissionVerdict;
import com.typepulse.anomaly.model.SubmittedKeystroke;
import com.typepulse.anomaly.model.SuspicionFlag;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

@Service
public class AntiCheatService {

  private static final Logger log = LoggerFactory.getLogger(AntiCheatService.class);

  private final AntiCheatValidator validator;
  private final RaceSubmissionValidator submissionValidator;
  private final ChallengePhrases phrases;
  private final MeterRegistry metrics;
  private final Counter suspiciousSessions;
  private final Counter submissionsValidated;
  private final Counter submissionsFlagged;

  public AntiCheatService(AntiCheatValidator validator,
                          RaceSubmissionValidator submissionValidator,
                          ChallengePhrases phrases,
                          MeterRegistry metrics) {
    this.validator = validator;
    this.submissionValidator = submissionValidator;
    this.phrases = phrases;
    this.metrics = metrics;
    this.suspiciousSessions = metrics.counter("typepulse_anticheat_suspicious_total");
    this.submissionsValidated = metrics.counter("typepulse_submissions_validated_total");
    this.submissionsFlagged = metrics.counter("typepulse_submissions_flagged_total");
  }

  public AntiCheatValidator validator() {
    return validator;
  }

  public AntiCheatResult validateSession(KeystrokeTimings timings, double wpm) {
    AntiCheatResult result = validator.validate(timings, wpm);
    record(result);
    return result;
  }

  /** Counts the flags of a result produced elsewhere, e.g. by the report assembler. */
  public void record(AntiCheatResult result) {
    countFlags(result.flags());
    if (result.suspicious()) {
      suspiciousSessions.increment();
      log.warn("Suspicious session: flags={} score={} minInterval={} variance={}",
          result.flags(), result.validationScore(), result.minInterval(), result.intervalVariance());
    } else if (result.syntheticInputDetected()) {
      log.info("Synthetic input signal without enough flags to mark suspicious: flags={}", result.flags());
    }
  }

  public SubmissionVerdict validateSubmission(List<SubmittedKeystroke> keystrokes, SubmissionContext ctx) {
    SubmissionVerdict verdict = submissionValidator.validate(keystrokes, ctx);
    submissionsValidated.increment();
    if (verdict.flagged()) {
      submissionsFlagged.increment();
      countFlags(verdict.flagReasons());
      log.warn("Race submission flagged: reasons={} serverWpm={} clientWpm={} review={} valid={}",
          verdict.flagReasons(), verdict.serverCalculatedWpm(), ctx.clientReportedWpm(),
          verdict.requiresReview(), verdict.valid());
    } else {
      log.debug("Race submission clean: keystrokes={} serverWpm={}", keystrokes.size(), verdict.serverCalculatedWpm());
    }
    return verdict;
  }

  public String issueChallenge(int triggeredWpm) {
    String text = phrases.next();
    log.info("Verification challenge issued at {} wpm", triggeredWpm);
    return text;
  }

  public ChallengeOutcome verifyChallenge(List<SubmittedKeystroke> keystrokes, int clientWpm) {
    ChallengeOutcome outcome = submissionValidator.verifyChallenge(keystrokes, clientWpm);
    if (outcome.passed()) {
      log.info("Verification challenge passed: serverWpm={} certifiedWpm={}", outcome.serverWpm(), outcome.certifiedWpm());
    } else {
      log.info("Verification challenge failed: {}", outcome.reason());
    }
    return outcome;
  }

  private void countFlags(Collection<SuspicionFlag> flags) {
    for (SuspicionFlag flag : flags) {
      metrics.counter("typepulse_anticheat_flags_total", "flag", flag.code()).increment();
    }
  }
}
