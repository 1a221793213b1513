package io.tickwork.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tickwork.core.ThrowablesUtil;
import io.tickwork.core.schedule.ClaimedSchedule;
import io.tickwork.core.schedule.ClaimedScheduleHandler;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints each claimed item as one line of JSON.
 */
class JsonClaimedSchedulePrinter
        implements ClaimedScheduleHandler
{
    private final ObjectMapper mapper;
    private final PrintStream out;

    JsonClaimedSchedulePrinter(ObjectMapper mapper, PrintStream out)
    {
        this.mapper = mapper;
        this.out = out;
    }

    @Override
    public void handle(List<ClaimedSchedule> claimed)
    {
        for (ClaimedSchedule c : claimed) {
            try {
                out.println(mapper.writeValueAsString(c));
            }
            catch (JsonProcessingException ex) {
                throw ThrowablesUtil.propagate(ex);
            }
        }
        out.flush();
    }
}
