package com.mktsim.tools;

import com.mktsim.common.SimConfig;
import com.mktsim.common.SimTime;
import com.mktsim.engine.agent.MarketReplayAgent;
import com.mktsim.engine.agent.ReplayRecord;
import com.mktsim.engine.book.LimitOrderBook;
import com.mktsim.engine.exchange.Exchange;
import com.mktsim.engine.kernel.Kernel;
import com.mktsim.engine.kernel.RunSummary;
import com.mktsim.protocol.Order;
import com.mktsim.protocol.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.List;

/**
 * Entry point for a market replay run.
 *
 * Usage:
 *   java -cp ... com.mktsim.tools.SimulationMain [config-path] [replay-csv]
 *
 * Replays the order stream into the first configured symbol's book and logs
 * the final top of book.
 */
public final class SimulationMain {

    private static final Logger log = LoggerFactory.getLogger(SimulationMain.class);

    private SimulationMain() {}

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        SimConfig cfg = SimConfig.load(configPath);
        if (args.length > 1) cfg.replayFile = args[1];

        if (cfg.replayFile == null) {
            log.error("No replay file configured (replayFile in config or second argument)");
            System.exit(2);
        }

        List<ReplayRecord> records = ReplayCsvLoader.load(Paths.get(cfg.replayFile));
        log.info("Loaded {} replay records from {}", records.size(), cfg.replayFile);

        run(cfg, records);
    }

    static RunSummary run(SimConfig cfg, List<ReplayRecord> records) {
        String symbol = cfg.symbols.get(0);
        Exchange exchange = new Exchange(cfg.symbols);
        Kernel kernel = new Kernel(cfg, exchange, null);
        MarketReplayAgent replay = new MarketReplayAgent(cfg.replayAgentId, symbol, records);
        kernel.addAgent(replay);

        RunSummary summary = kernel.run();

        LimitOrderBook book = exchange.book(symbol);
        log.info("Run finished at {} after {} events ({})",
                SimTime.format(summary.finalTime()), summary.eventsDelivered(), summary.stopReason());
        log.info("{}: executions={} last={} bid={} ask={} resting={}",
                symbol, replay.executions().size(),
                book.lastTradePrice() == null ? "-" : Order.dollarize(book.lastTradePrice()),
                book.isSideEmpty(Side.BUY) ? "-" : Order.dollarize(book.bestBid()),
                book.isSideEmpty(Side.SELL) ? "-" : Order.dollarize(book.bestAsk()),
                book.size());
        return summary;
    }
}
