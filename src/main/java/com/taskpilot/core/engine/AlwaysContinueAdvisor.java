package com.taskpilot.core.engine;

import com.taskpilot.core.model.TaskRecord;
import org.springframework.stereotype.Component;

@Component
public class AlwaysContinueAdvisor implements ContinuationAdvisor {

    @Override
    public Advice advise(TaskRecord partial) {
        return Advice.CONTINUE;
    }
}
