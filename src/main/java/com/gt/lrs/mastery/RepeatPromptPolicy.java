package com.gt.lrs.mastery;

import com.gt.lrs.model.RepeatFlag;

// Decides whether the client should ask the learner about re-queuing the alphabet after a submission
public interface RepeatPromptPolicy {

    boolean shouldAskForRepeat(long userId, RepeatFlag repeatFlag);
}
