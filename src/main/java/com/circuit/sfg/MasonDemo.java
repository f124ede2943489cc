package com.circuit.sfg;

import com.circuit.sfg.engine.LoopGainResponse;
import com.circuit.sfg.engine.TransferFunction;
import com.circuit.sfg.util.AnalysisStatsListener;

import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Runs Mason's rule over the bundled sample graphs, or over the JSON files
 * given on the command line.
 */
@Log4j2
public class MasonDemo {

    private static final String[] SAMPLES = {
            "graphs/feedback_chain.json",
            "graphs/two_loops.json",
            "graphs/amplifier.json"
    };

    public static void main(String[] args) {
        log.info("Starting Mason Demo...");
        if (args.length == 0) {
            for (String resource : SAMPLES)
                analyze(SfgAnalyzer.fromResource(resource));
        } else {
            for (String file : args)
                analyze(new SfgAnalyzer(Path.of(file)));
        }
    }

    private static void analyze(SfgAnalyzer analyzer) {
        AnalysisStatsListener stats = new AnalysisStatsListener();
        analyzer.addListener(stats);
        log.info("\n{}", analyzer.explain());

        TransferFunction tf = analyzer.transferFunction();
        log.info(tf.describe());
        log.info("Bode phase: {}", tf.bodePhase());
        log.info("Bode magnitude: {}", tf.bodeMagnitude());

        LoopGainResponse lg = analyzer.loopGain();
        log.info("Loop gain: {}", lg.loopGain());

        log.info("Stats: loops={}, forwardPaths={}, cofactors={}, combinations={}",
                stats.getLoopsFound(), stats.getForwardPaths(), stats.getCofactors(),
                stats.getCombinationsByOrder());
    }
}
