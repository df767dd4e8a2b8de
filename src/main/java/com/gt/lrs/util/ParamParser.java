package com.gt.lrs.util;

import com.gt.lrs.exception.ValidationException;
import com.gt.lrs.model.RepeatFlag;
import com.gt.lrs.model.Script;
import com.gt.lrs.model.Skill;
import com.gt.lrs.model.UserLocale;

// Turns raw request values into enums, rejecting anything unknown with a ValidationException
public final class ParamParser {

    private ParamParser() { }

    public static Script parseScript(String scriptId) {
        Script script = Script.getScriptById(scriptId);
        if (script == null) {
            throw new ValidationException("Invalid script: " + scriptId + ", must be 'hiragana' or 'katakana'");
        }
        return script;
    }

    public static Skill parseSkill(String skillId) {
        Skill skill = Skill.getSkillById(skillId);
        if (skill == null) {
            throw new ValidationException("Invalid skill: " + skillId + ", must be 'reading', 'writing', or 'listening'");
        }
        return skill;
    }

    public static UserLocale parseLocale(String localeId) {
        UserLocale locale = UserLocale.getLocaleById(localeId);
        if (locale == null) {
            throw new ValidationException("Invalid locale: " + localeId + ", must be 'en', 'ru', or 'de'");
        }
        return locale;
    }

    // A missing or blank flag means the default
    public static RepeatFlag parseRepeatFlag(String repeatFlagId) {
        if (repeatFlagId == null || repeatFlagId.isBlank()) {
            return RepeatFlag.DEFAULT;
        }

        RepeatFlag repeatFlag = RepeatFlag.getRepeatFlagById(repeatFlagId);
        if (repeatFlag == null) {
            throw new ValidationException("Invalid repeat flag: " + repeatFlagId + ", must be 'in question', 'ignore', or 'repeat'");
        }
        return repeatFlag;
    }
}
